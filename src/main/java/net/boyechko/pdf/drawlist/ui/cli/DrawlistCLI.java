/*
 * PDF-Drawlist - PDF content stream interpretation into draw command lists
 * Copyright (C) 2025 Richard Boyechko
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published
 * by the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package net.boyechko.pdf.drawlist.ui.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import javax.imageio.ImageIO;
import net.boyechko.pdf.drawlist.core.DocumentRenderService;
import net.boyechko.pdf.drawlist.core.PageDrawing;
import net.boyechko.pdf.drawlist.core.PageRange;
import net.boyechko.pdf.drawlist.core.RenderResult;
import net.boyechko.pdf.drawlist.core.RenderSettings;
import net.boyechko.pdf.drawlist.core.VerbosityLevel;
import net.boyechko.pdf.drawlist.document.PdfCustodian;
import net.boyechko.pdf.drawlist.image.Bitmap;
import net.boyechko.pdf.drawlist.interpret.FormCacheScope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class DrawlistCLI {
    private static Logger logger;

    // Configuration record to hold parsed CLI arguments
    public record CLIConfig(
            Path inputPath,
            String password,
            PageRange pageRange,
            Path imagesDir,
            RenderSettings settings,
            VerbosityLevel verbosity) {
        public CLIConfig {
            if (inputPath == null) {
                throw new IllegalArgumentException("Input path is required");
            }
            if (verbosity == null) {
                throw new IllegalArgumentException("Verbosity level is required");
            }
        }
    }

    // Custom exception for CLI errors
    public static class CLIException extends Exception {
        public CLIException(String message) {
            super(message);
        }
    }

    /** Mutable builder that accumulates parsed CLI arguments. */
    static class CLIConfigBuilder {
        Path inputPath;
        String password;
        PageRange pageRange = PageRange.all();
        Path imagesDir;
        Double fontScaleMetrics;
        Double fontScaleSize;
        FormCacheScope formCacheScope;
        VerbosityLevel verbosity = VerbosityLevel.NORMAL;
        boolean checkInputExists = true;

        CLIConfig build(RenderSettings base) throws CLIException {
            if (inputPath == null) {
                throw new CLIException("No input file specified");
            }
            if (checkInputExists && !Files.exists(inputPath)) {
                throw new CLIException("File not found: " + inputPath);
            }
            RenderSettings settings = base;
            try {
                if (fontScaleMetrics != null || fontScaleSize != null) {
                    settings =
                            settings.withFontScales(
                                    fontScaleMetrics != null
                                            ? fontScaleMetrics
                                            : settings.fontScaleMetrics(),
                                    fontScaleSize != null
                                            ? fontScaleSize
                                            : settings.fontScaleSize());
                }
            } catch (IllegalArgumentException e) {
                throw new CLIException(e.getMessage());
            }
            if (formCacheScope != null) {
                settings = settings.withFormCacheScope(formCacheScope);
            }
            return new CLIConfig(inputPath, password, pageRange, imagesDir, settings, verbosity);
        }
    }

    public static void main(String[] args) {
        try {
            if (isHelpRequested(args)) {
                System.out.println(usageMessage());
                return;
            }
            CLIConfig config = parseArguments(args, true);
            configureLogging(config.verbosity());
            logger().info(
                            "Starting rendering of {} with verbosity level {}",
                            config.inputPath(),
                            config.verbosity());
            if (!processFile(config)) {
                System.exit(2);
            }
        } catch (CLIException e) {
            System.err.println("Error: " + e.getMessage());
            System.exit(1);
        }
    }

    static CLIConfig parseArguments(String[] args, boolean checkInputExists) throws CLIException {
        if (args.length == 0) {
            throw new CLIException("No input file specified\n" + usageMessage());
        }

        CLIConfigBuilder b = new CLIConfigBuilder();
        b.checkInputExists = checkInputExists;

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (arg.startsWith("--pages=")) {
                b.pageRange = parsePageRange(valueOf(arg, "--pages="));
            } else if (arg.startsWith("--images=")) {
                b.imagesDir = Paths.get(valueOf(arg, "--images="));
            } else if (arg.startsWith("--font-scale-metrics=")) {
                b.fontScaleMetrics = parseScale(valueOf(arg, "--font-scale-metrics="));
            } else if (arg.startsWith("--font-scale-size=")) {
                b.fontScaleSize = parseScale(valueOf(arg, "--font-scale-size="));
            } else if (arg.startsWith("--form-cache=")) {
                b.formCacheScope = parseFormCacheScope(valueOf(arg, "--form-cache="));
            } else {
                switch (arg) {
                    case "-p", "--password" -> {
                        if (i + 1 < args.length) {
                            b.password = args[++i];
                        } else {
                            throw new CLIException("Password not specified after -p");
                        }
                    }
                    case "-q", "--quiet" -> b.verbosity = VerbosityLevel.QUIET;
                    case "-v", "--verbose" -> b.verbosity = VerbosityLevel.VERBOSE;
                    case "-vv", "--debug" -> b.verbosity = VerbosityLevel.DEBUG;
                    default -> {
                        if (arg.startsWith("-")) {
                            throw new CLIException("Unknown option: " + arg);
                        } else if (b.inputPath == null) {
                            b.inputPath = Paths.get(arg);
                        } else {
                            throw new CLIException("Multiple input files specified");
                        }
                    }
                }
            }
        }

        try {
            return b.build(RenderSettings.fromEnvironment());
        } catch (IllegalArgumentException e) {
            throw new CLIException(e.getMessage());
        }
    }

    private static void configureLogging(VerbosityLevel verbosity) {
        if (LoggerFactory.getILoggerFactory() instanceof LoggerContext ctx) {
            ctx.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(Level.toLevel(verbosity.logLevel()));
        }
    }

    private static Logger logger() {
        if (logger == null) {
            logger = LoggerFactory.getLogger(DrawlistCLI.class);
        }
        return logger;
    }

    /** Renders the document; returns false if it could not be rendered at all. */
    private static boolean processFile(CLIConfig config) {
        ConsoleRenderListener listener =
                new ConsoleRenderListener(
                        System.out, config.verbosity(), config.inputPath().toString());
        try {
            DocumentRenderService service =
                    new DocumentRenderService.DocumentRenderServiceBuilder()
                            .withPdfCustodian(
                                    new PdfCustodian(config.inputPath(), config.password()))
                            .withListener(listener)
                            .withSettings(config.settings())
                            .withPageRange(config.pageRange())
                            .build();
            RenderResult result = service.render();
            if (config.imagesDir() != null) {
                int written = exportImages(result.pages(), config.imagesDir());
                listener.onSuccess(written + " image(s) written to " + config.imagesDir());
            }
            if (config.verbosity() == VerbosityLevel.QUIET) {
                System.out.println(
                        result.pages().size()
                                + " page(s), "
                                + result.totalCommands()
                                + " command(s)");
            }
            return true;
        } catch (IOException e) {
            logger().error("Rendering of {} failed", config.inputPath(), e);
            listener.onError("Rendering failed: " + e.getMessage());
            return false;
        }
    }

    /** Writes each decoded bitmap as {@code page<N>-img<K>.png}; K counts from 1 per page. */
    static int exportImages(List<PageDrawing> pages, Path dir) throws IOException {
        Files.createDirectories(dir);
        int written = 0;
        for (PageDrawing page : pages) {
            int index = 0;
            for (Bitmap bitmap : page.bitmaps()) {
                index++;
                Path file = dir.resolve("page" + page.pageNum() + "-img" + index + ".png");
                if (!ImageIO.write(bitmap.toBufferedImage(), "png", file.toFile())) {
                    throw new IOException("No PNG writer available for " + file);
                }
                logger().debug("Wrote {}", file);
                written++;
            }
        }
        return written;
    }

    private static String valueOf(String arg, String prefix) throws CLIException {
        String value = arg.substring(prefix.length());
        if (value.isBlank()) {
            throw new CLIException("Missing value for " + prefix.substring(0, prefix.length() - 1));
        }
        return value;
    }

    private static PageRange parsePageRange(String value) throws CLIException {
        try {
            return PageRange.parse(value);
        } catch (IllegalArgumentException e) {
            throw new CLIException(e.getMessage());
        }
    }

    private static double parseScale(String value) throws CLIException {
        try {
            double scale = Double.parseDouble(value);
            if (scale <= 0) {
                throw new CLIException("Font scale must be positive: " + value);
            }
            return scale;
        } catch (NumberFormatException e) {
            throw new CLIException("Font scale is not a number: " + value);
        }
    }

    private static FormCacheScope parseFormCacheScope(String value) throws CLIException {
        try {
            return RenderSettings.parseScope(value, FormCacheScope.RESOURCES);
        } catch (IllegalArgumentException e) {
            throw new CLIException(e.getMessage() + " (expected document or resources)");
        }
    }

    private static boolean isHelpRequested(String[] args) {
        for (String arg : args) {
            if ("-h".equals(arg) || "--help".equals(arg)) {
                return true;
            }
        }
        return false;
    }

    private static String usageMessage() {
        return "Usage: java DrawlistCLI [-q|-v|-vv] [-p password] [--pages=N|N-M] [--images=DIR]"
                + " <input.pdf>\n"
                + "  -h, --help                Show this help message\n"
                + "  -q, --quiet               Only show errors and totals\n"
                + "  -v, --verbose             List every draw command\n"
                + "  -vv, --debug              Show all debug information\n"
                + "  -p, --password            Password for encrypted PDFs\n"
                + "  --pages=N|N-M             Render only these pages (1-based)\n"
                + "  --images=DIR              Write decoded images as PNG files to DIR\n"
                + "  --font-scale-metrics=F    Scale the font size used for text measurement\n"
                + "  --font-scale-size=F       Scale the font size used for drawing text\n"
                + "  --form-cache=SCOPE        Share form expansions per 'document' or per"
                + " 'resources'\n"
                + "Examples:\n"
                + "  java DrawlistCLI -v document.pdf\n"
                + "  java DrawlistCLI --pages=2-4 --images=out document.pdf";
    }
}
