package com.regolith.core.flavor.impl;

import com.regolith.core.ast.Regexp;
import com.regolith.core.flavor.FeatureSet;
import com.regolith.core.flavor.FlagInfo;
import com.regolith.core.flavor.Flavor;
import com.regolith.core.flavor.RegexParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * POSIX Extended Regular Expressions as defined by IEEE Std 1003.1, without GNU
 * extensions.
 *
 * <p>Supports alternation, capturing groups, the {@code * + ?} and interval quantifiers,
 * anchors, the any-character dot and bracket expressions with POSIX character classes.
 * Perl-style escapes such as {@code \d} and back-references are rejected with a message
 * that suggests the POSIX spelling.
 *
 * <p>POSIX ERE has no inline flags; flags such as case-insensitivity are passed to the
 * matching tool instead (e.g., {@code grep -i}).
 */
public class PosixEreFlavor implements Flavor {

    private static final Logger log = LoggerFactory.getLogger(PosixEreFlavor.class);

    private static final FeatureSet FEATURES = FeatureSet.builder()
        .posixClasses(true)
        .build();

    @Override
    public String getId() {
        return "posix-ere";
    }

    @Override
    public String getDisplayName() {
        return "POSIX Extended Regular Expressions (IEEE Std 1003.1)";
    }

    @Override
    public Regexp parse(String pattern) throws RegexParseException {
        Objects.requireNonNull(pattern, "pattern must not be null");
        Regexp regexp = new PosixEreParser(pattern).parse();
        log.debug("Parsed POSIX ERE pattern '{}' into {} branch(es)", pattern, regexp.matches().size());
        return regexp;
    }

    @Override
    public List<FlagInfo> getSupportedFlags() {
        return List.of();
    }

    @Override
    public FeatureSet getSupportedFeatures() {
        return FEATURES;
    }
}
