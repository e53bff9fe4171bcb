package com.project.image.enhancement.cli;

import com.project.image.enhancement.DTOs.PipelineConfig;

import java.nio.file.Path;
import java.util.List;

/**
 * Command-line options. Both {@code --flag value} and {@code --flag=value} are accepted;
 * unknown flags (for example Spring properties) are ignored.
 */
public record EnhanceArguments(
        Path input,
        Path output,
        Path cascade,
        String superResModel,
        double superResScale,
        double sharpenAmount,
        boolean helpRequested
) {
    public static final String DEFAULT_OUTPUT = "enhanced.png";
    public static final String DEFAULT_CASCADE = "haarcascade_frontalface_default.xml";

    private static final List<String> FLAGS = List.of(
            "--input", "--output", "--cascade", "--sr_model", "--sr_scale", "--sharpen", "--help", "-h");

    public static final String USAGE = String.join(System.lineSeparator(),
            "Usage: image_enhancer --input <path> [--output out.png] [--cascade haar.xml]",
            "       [--sr_model model.pb] [--sr_scale 2|3|4]",
            "       [--sharpen 0..3]");

    public static boolean isCommandLineInvocation(String[] args) {
        for (String arg : args) {
            String key = arg.contains("=") ? arg.substring(0, arg.indexOf('=')) : arg;
            if (FLAGS.contains(key)) {
                return true;
            }
        }
        return false;
    }

    /**
     * @throws IllegalArgumentException when {@code --input} is missing or a number cannot be parsed
     */
    public static EnhanceArguments parse(String[] args) {
        String input = null;
        String output = DEFAULT_OUTPUT;
        String cascade = DEFAULT_CASCADE;
        String srModel = "";
        double srScale = PipelineConfig.DEFAULT_SUPER_RES_SCALE;
        double sharpen = PipelineConfig.DEFAULT_SHARPEN_AMOUNT;

        for (int i = 0; i < args.length; i++) {
            String key = args[i];
            String value = null;
            int eq = key.indexOf('=');
            if (key.startsWith("--") && eq > 0) {
                value = key.substring(eq + 1);
                key = key.substring(0, eq);
            }
            if (key.equals("--help") || key.equals("-h")) {
                return new EnhanceArguments(null, null, null, "", srScale, sharpen, true);
            }
            if (!FLAGS.contains(key)) {
                continue;
            }
            if (value == null) {
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("Missing value for " + key);
                }
                value = args[++i];
            }
            if (key.equals("--input")) {
                input = value;
            } else if (key.equals("--output")) {
                output = value;
            } else if (key.equals("--cascade")) {
                cascade = value;
            } else if (key.equals("--sr_model")) {
                srModel = value;
            } else if (key.equals("--sr_scale")) {
                srScale = parseNumber(key, value);
            } else if (key.equals("--sharpen")) {
                sharpen = parseNumber(key, value);
            }
        }

        if (input == null || input.isBlank()) {
            throw new IllegalArgumentException("--input is required");
        }
        return new EnhanceArguments(Path.of(input), Path.of(output), Path.of(cascade), srModel, srScale, sharpen, false);
    }

    public PipelineConfig toPipelineConfig() {
        return new PipelineConfig(sharpenAmount, superResModel, superResScale);
    }

    private static double parseNumber(String key, String value) {
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number for " + key + ": " + value, e);
        }
    }
}
