package com.mimecast.enquiry.main;

import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonPrimitive;
import com.google.gson.JsonSerializer;
import com.mimecast.enquiry.EmailFileResult;
import com.mimecast.enquiry.EmailFileService;
import com.mimecast.enquiry.MsgParser;
import com.mimecast.enquiry.ParsedEmail;
import com.mimecast.enquiry.enquiry.HistoryEntryBuilder;
import com.mimecast.enquiry.logging.Log4jFileOperationsLog;
import com.mimecast.enquiry.validation.EmailFileValidator;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.help.HelpFormatter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Command line parser for mail container files.
 *
 * <p>Prints the parse result as JSON:
 * <pre>
 *     java -jar enquiry-mail.jar --file message.msg --mode full
 * </pre>
 */
public class Main {
    private static final Logger log = LogManager.getLogger(Main.class);

    /**
     * JSON writer.
     */
    static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .disableHtmlEscaping()
            .setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES)
            .registerTypeAdapter(ZonedDateTime.class, (JsonSerializer<ZonedDateTime>) (src, type, context) ->
                    new JsonPrimitive(DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(src)))
            .create();

    /**
     * Output stream.
     */
    private final PrintStream out;

    /**
     * Main runnable.
     *
     * @param args String array.
     */
    public static void main(String[] args) {
        new Main(System.out).run(args);
    }

    /**
     * Constructs a new Main instance.
     *
     * @param out Output stream.
     */
    Main(PrintStream out) {
        this.out = out;
    }

    /**
     * Runs with arguments.
     *
     * @param args String array.
     * @return Boolean, true when parsing succeeded.
     */
    boolean run(String[] args) {
        Options options = options();
        Optional<CommandLine> opt = parseArgs(options, args);
        if (opt.isEmpty() || !opt.get().hasOption("file")) {
            optionsUsage(options);
            return false;
        }

        CommandLine cmd = opt.get();
        if (cmd.hasOption("config")) {
            try {
                Config.initParser(cmd.getOptionValue("config"));
            } catch (IOException e) {
                log.error("Unable to load config: {}", e.getMessage());
                print(Map.of("success", false, "error", "Unable to load config: " + e.getMessage()));
                return false;
            }
        }

        EmailFileService service = new EmailFileService(
                new EmailFileValidator(Config.getParser().getUpload()),
                new MsgParser(Config.getParser(), new Log4jFileOperationsLog()));

        Path path = Paths.get(cmd.getOptionValue("file"));
        EmailFileResult result = service.parse(path, cmd.getOptionValue("mode", "snippet"), cmd.hasOption("skip-attachments"));

        Map<String, Object> output = new LinkedHashMap<>();
        output.put("success", result.isSuccess());
        if (result.getEmail().isPresent()) {
            ParsedEmail email = result.getEmail().get();
            output.put("parsing_mode", result.getMode().name().toLowerCase(Locale.ROOT));
            output.put("email_data", email);
            if (cmd.hasOption("history")) {
                output.put("history", new HistoryEntryBuilder().build(email));
            }
        } else {
            output.put("error", result.getError());
            output.put("error_type", result.getErrorType().getName());
        }

        print(output);
        return result.isSuccess();
    }

    /**
     * CLI options.
     * <p>Listing order will be alphabetical.
     *
     * @return Options instance.
     */
    static Options options() {
        Options options = new Options();
        options.addOption("f", "file", true, "Mail container file (.msg)");
        options.addOption("m", "mode", true, "Body mode: snippet, plain or full (default: snippet)");
        options.addOption("s", "skip-attachments", false, "Do not extract attachments");
        options.addOption("c", "config", true, "Parser configuration file (JSON5)");
        options.addOption("H", "history", false, "Include history entry for the message");
        return options;
    }

    /**
     * CLI usage.
     *
     * @param options CLI options.
     */
    private void optionsUsage(Options options) {
        out.println("java -jar enquiry-mail.jar");
        out.println(" Mail container parser");
        out.println();

        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        PrintStream ps = new PrintStream(baos);
        PrintStream oldOut = System.out;
        System.setOut(ps);

        try {
            HelpFormatter formatter = HelpFormatter.builder()
                    .setShowSince(false)
                    .get();
            formatter.printHelp(" ", "", options, "", true);
            System.out.flush();
        } catch (IOException e) {
            throw new IllegalStateException(e);
        } finally {
            System.setOut(oldOut);
        }

        out.println(baos);
    }

    /**
     * Parser for CLI arguments.
     *
     * @param options Options instance.
     * @param args    Arguments string array.
     * @return Optional of CommandLine.
     */
    private Optional<CommandLine> parseArgs(Options options, String[] args) {
        CommandLine cmd = null;

        try {
            cmd = new DefaultParser().parse(options, args, true);
        } catch (Exception e) {
            out.println("Ran into a problem: " + e.getMessage());
            out.println();
        }

        return Optional.ofNullable(cmd);
    }

    private void print(Object object) {
        out.println(GSON.toJson(object));
    }
}
