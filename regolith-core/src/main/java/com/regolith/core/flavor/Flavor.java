package com.regolith.core.flavor;

import com.regolith.core.ast.Regexp;

import java.util.List;

/**
 * Interface for regex flavors that turn pattern text into the shared AST.
 *
 * <p>Each flavor implements the grammar of one regex dialect (POSIX ERE, PCRE,
 * JavaScript, ...) and produces a {@link Regexp} tree that the diagram renderer
 * consumes. Flavors differ only in what they accept; the tree they produce is the same
 * for equivalent constructs.
 *
 * <p>Flavors are discovered via Java Service Provider Interface (SPI) and looked up by
 * id through {@link FlavorRegistry}.
 *
 * <p><b>Example Implementation:</b>
 * <pre>{@code
 * public class PosixEreFlavor implements Flavor {
 *     @Override
 *     public String getId() {
 *         return "posix-ere";
 *     }
 *
 *     @Override
 *     public String getDisplayName() {
 *         return "POSIX Extended Regular Expressions (IEEE Std 1003.1)";
 *     }
 *
 *     @Override
 *     public Regexp parse(String pattern) throws RegexParseException {
 *         return new PosixEreParser(pattern).parse();
 *     }
 *
 *     @Override
 *     public List<FlagInfo> getSupportedFlags() {
 *         return List.of();
 *     }
 *
 *     @Override
 *     public FeatureSet getSupportedFeatures() {
 *         return FeatureSet.builder().posixClasses(true).build();
 *     }
 * }
 * }</pre>
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.regolith.core.flavor.Flavor}
 *
 * @see FlavorRegistry
 * @see FeatureSet
 * @see RegexParseException
 */
public interface Flavor {

    /**
     * Returns unique identifier for this flavor.
     *
     * <p>Used on the command line and in lookups. Should be lowercase with dashes
     * (e.g., "posix-ere", "pcre", "javascript").
     *
     * @return unique flavor identifier
     */
    String getId();

    /**
     * Returns human-readable display name for this flavor.
     *
     * <p>Used in CLI listings and logs.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Parses a pattern into an AST.
     *
     * <p>Implementations must be stateless between calls so one instance can parse
     * from several threads.
     *
     * @param pattern the pattern text, without delimiters
     * @return root of the parsed expression
     * @throws RegexParseException if the pattern is not valid in this flavor
     */
    Regexp parse(String pattern) throws RegexParseException;

    /**
     * Returns the flags this flavor understands, in display order.
     *
     * @return supported flags, empty when the flavor has none
     */
    List<FlagInfo> getSupportedFlags();

    /**
     * Returns the syntax features this flavor accepts.
     *
     * @return feature capabilities
     */
    FeatureSet getSupportedFeatures();
}
