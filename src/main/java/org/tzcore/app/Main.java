package org.tzcore.app;

import org.tzcore.core.error.TimezoneException;
import org.tzcore.zone.convert.ZonedDateValue;
import org.tzcore.zone.resolve.TimezoneDescriptor;
import org.tzcore.zone.resolve.ZoneLookupResult;
import org.tzcore.zone.runtime.TimezoneRuntimeBinder;
import org.tzcore.zone.runtime.TimezoneRuntimeConfig;

import java.io.PrintStream;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;

/**
 * Command-line entry point used for local smoke runs.
 *
 * <pre>
 * resolve &lt;identifier&gt; [yyyy-MM-ddTHH:mm:ss]
 * convert &lt;yyyy-MM-ddTHH:mm:ss&gt; &lt;fromIdentifier&gt; &lt;toIdentifier&gt;
 * </pre>
 */
public class Main {
    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_NOT_FOUND = 2;
    static final int EXIT_FAILURE = 3;

    /**
     * Runs one command and exits with its status.
     *
     * @param args command-line arguments.
     */
    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err, Clock.systemUTC()));
    }

    static int run(String[] args, PrintStream out, PrintStream err, Clock clock) {
        if (args.length == 0) {
            return usage(err);
        }
        TimezoneRuntimeBinder.Binding binding = new TimezoneRuntimeBinder().bind(
                TimezoneRuntimeConfig.builder().clock(clock).build());
        try {
            switch (args[0]) {
                case "resolve":
                    return resolve(args, binding, out, err, clock);
                case "convert":
                    return convert(args, binding, out, err);
                default:
                    return usage(err);
            }
        } catch (DateTimeParseException ex) {
            err.println("invalid date/time: " + ex.getParsedString());
            return EXIT_USAGE;
        } catch (TimezoneException ex) {
            err.println(ex.getMessage());
            return ex.isFatal() ? EXIT_FAILURE : EXIT_NOT_FOUND;
        }
    }

    private static int resolve(
            String[] args,
            TimezoneRuntimeBinder.Binding binding,
            PrintStream out,
            PrintStream err,
            Clock clock
    ) {
        if (args.length < 2 || args.length > 3) {
            return usage(err);
        }
        LocalDateTime wallTime = args.length == 3 ? LocalDateTime.parse(args[2]) : LocalDateTime.now(clock);
        ZoneLookupResult result = binding.getZoneResolver().lookup(args[1], wallTime);
        if (!result.isFound()) {
            err.println("No timezone found for: " + result.getIdentifier());
            return EXIT_NOT_FOUND;
        }
        out.println(result.getDescriptor());
        return EXIT_OK;
    }

    private static int convert(String[] args, TimezoneRuntimeBinder.Binding binding, PrintStream out, PrintStream err) {
        if (args.length != 4) {
            return usage(err);
        }
        LocalDateTime wallTime = LocalDateTime.parse(args[1]);
        ZoneLookupResult origin = binding.getZoneResolver().lookup(args[2], wallTime);
        if (!origin.isFound()) {
            err.println("No timezone found for: " + origin.getIdentifier());
            return EXIT_NOT_FOUND;
        }
        ZoneLookupResult target = binding.getZoneResolver().lookup(args[3], wallTime);
        if (!target.isFound()) {
            err.println("No timezone found for: " + target.getIdentifier());
            return EXIT_NOT_FOUND;
        }
        ZonedDateValue converted = binding.getOffsetCalculator()
                .convert(ZonedDateValue.of(wallTime, origin.getDescriptor()), target.getDescriptor());
        TimezoneDescriptor zone = converted.getTimezone();
        out.println(converted.getWallTime() + " " + zone.getAbbreviation() + " (" + zone.getFullName() + ")");
        return EXIT_OK;
    }

    private static int usage(PrintStream err) {
        err.println("usage: resolve <identifier> [yyyy-MM-ddTHH:mm:ss]");
        err.println("       convert <yyyy-MM-ddTHH:mm:ss> <fromIdentifier> <toIdentifier>");
        return EXIT_USAGE;
    }
}
