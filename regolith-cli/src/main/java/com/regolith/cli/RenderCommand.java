package com.regolith.cli;

import com.regolith.core.ast.Regexp;
import com.regolith.core.config.RenderConfig;
import com.regolith.core.config.RenderConfigLoader;
import com.regolith.core.flavor.Flavor;
import com.regolith.core.flavor.FlavorRegistry;
import com.regolith.core.flavor.ParseErrorFormatter;
import com.regolith.core.flavor.RegexParseException;
import com.regolith.core.renderer.DiagramRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Command to render a regex pattern to an SVG file.
 *
 * <p>The pattern comes from the positional argument or, when that is omitted and input
 * is piped, from standard input. Styles start from the defaults, are replaced by a YAML
 * style file when {@code --config} is given, and are then overridden by the individual
 * style options.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * regolith render 'a|b|c'
 * regolith render -o output.svg '[a-z]+'
 * regolith render --literal-fill '#ff0000' 'hello'
 * echo '^hello$' | regolith render
 * }</pre>
 *
 * <p>Exit codes: 0 on success, 1 for an unknown flavor, a missing or invalid pattern, or
 * an output file that cannot be written.
 */
@Command(
    name = "render",
    description = "Render a regular expression as an SVG railroad diagram",
    mixinStandardHelpOptions = true
)
public class RenderCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RenderCommand.class);

    /** Approximate monospace character width relative to the font size. */
    static final double CHAR_WIDTH_RATIO = 0.6;

    @Spec
    private CommandSpec spec;

    @Parameters(
        index = "0",
        arity = "0..1",
        description = "Regular expression to visualize (reads from stdin if omitted)"
    )
    private String pattern;

    @Option(names = {"-o", "--output"}, description = "Output file path (default: ${DEFAULT-VALUE})")
    private Path output = Paths.get("regex.svg");

    @Option(names = {"-f", "--flavor"}, description = "Regex flavor (default: ${DEFAULT-VALUE})")
    private String flavorId = "posix-ere";

    @Option(names = {"-c", "--config"}, description = "YAML style file")
    private Path configPath;

    @Option(names = "--padding", description = "Padding around diagram")
    private Double padding;

    @Option(names = "--font-size", description = "Font size in pixels")
    private Double fontSize;

    @Option(names = "--line-width", description = "Stroke width for lines")
    private Double lineWidth;

    @Option(names = "--text-color", description = "Text color")
    private String textColor;

    @Option(names = "--line-color", description = "Line/stroke color")
    private String lineColor;

    @Option(names = "--literal-fill", description = "Literal box fill color")
    private String literalFill;

    @Option(names = "--charset-fill", description = "Character set box fill color")
    private String charsetFill;

    @Option(names = "--escape-fill", description = "Escape sequence box fill color")
    private String escapeFill;

    @Option(names = "--anchor-fill", description = "Anchor box fill color")
    private String anchorFill;

    @Option(names = "--subexp-fill",
        description = "Outermost group box fill color (nested groups use cycling colors)")
    private String subexpFill;

    private final InputStream stdin;
    private final FlavorRegistry registry;

    /**
     * Creates the command reading piped standard input and discovering flavors on the
     * classpath.
     */
    public RenderCommand() {
        this(System.console() == null ? System.in : null, FlavorRegistry.loadDefault());
    }

    /**
     * Creates the command with explicit input and flavors.
     *
     * @param stdin source for the pattern when no argument is given, or {@code null}
     *              when there is no piped input
     * @param registry flavors to choose from
     */
    public RenderCommand(InputStream stdin, FlavorRegistry registry) {
        this.stdin = stdin;
        this.registry = registry;
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        Optional<Flavor> flavor = registry.find(flavorId);
        if (flavor.isEmpty()) {
            err.printf("Error: unknown flavor '%s'%n", flavorId);
            err.printf("Available flavors: %s%n", String.join(", ", registry.ids()));
            err.flush();
            return 1;
        }

        String input;
        try {
            input = readPattern();
        } catch (IOException e) {
            log.error("Failed to read pattern from stdin", e);
            err.printf("Error: failed to read from stdin: %s%n", e.getMessage());
            err.flush();
            return 1;
        }
        if (input == null) {
            err.println("Error: no pattern provided");
            err.println("Use 'regolith render --help' for usage");
            err.flush();
            return 1;
        }

        Regexp ast;
        try {
            log.info("Parsing pattern with flavor: {}", flavor.get().getId());
            ast = flavor.get().parse(input);
        } catch (RegexParseException e) {
            log.debug("Parse failed at {}:{}", e.getLine(), e.getColumn());
            err.println(ParseErrorFormatter.format(input, e));
            err.flush();
            return 1;
        }

        String svg = new DiagramRenderer(buildConfig()).render(ast, input);

        try {
            Path parent = output.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(output, svg, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.error("Failed to write {}", output, e);
            err.printf("Error writing output file: %s%n", e.getMessage());
            err.flush();
            return 1;
        }

        log.info("Wrote {} characters to {}", svg.length(), output);
        out.printf("Wrote %s%n", output);
        out.flush();
        return 0;
    }

    /**
     * Returns the pattern argument, else trimmed piped input, else {@code null}.
     */
    private String readPattern() throws IOException {
        if (pattern != null) {
            return pattern;
        }
        if (stdin == null) {
            return null;
        }
        return new String(stdin.readAllBytes(), StandardCharsets.UTF_8).strip();
    }

    /**
     * Layers the style options over the style file (or the defaults).
     *
     * @return effective render configuration
     */
    RenderConfig buildConfig() {
        RenderConfig base = configPath != null ? RenderConfigLoader.load(configPath) : RenderConfig.defaults();
        RenderConfig.Builder builder = base.toBuilder();

        if (padding != null) {
            builder.padding(padding);
        }
        if (fontSize != null) {
            builder.fontSize(fontSize).charWidth(fontSize * CHAR_WIDTH_RATIO);
        }
        if (lineWidth != null) {
            builder.lineWidth(lineWidth);
        }
        if (textColor != null) {
            builder.textColor(textColor);
        }
        if (lineColor != null) {
            builder.lineColor(lineColor);
        }
        if (literalFill != null) {
            builder.literalFill(literalFill);
        }
        if (charsetFill != null) {
            builder.charsetFill(charsetFill);
        }
        if (escapeFill != null) {
            builder.escapeFill(escapeFill);
        }
        if (anchorFill != null) {
            builder.anchorFill(anchorFill);
        }
        if (subexpFill != null) {
            builder.subexpFill(subexpFill);
        }
        return builder.build();
    }
}
