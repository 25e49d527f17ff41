package com.swatcl.script;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import com.swatcl.debug.Debug;
import com.swatcl.script.json.ExprTreeJson;
import com.swatcl.script.parser.EvalException;

/**
 * Evaluates one expression per line:
 *
 *   SwatclExprCli [--json] [name=value ...] [file]
 *
 * Lines come from the file, or stdin when none is given. Blank lines and
 * lines starting with '#' are skipped. With --json the parsed tree is
 * printed instead of the result. Set SWATCL_DEBUG to a level name (trace,
 * debug, ...) to trace to stderr.
 */
public final class SwatclExprCli {

    private static final String TAG = "swatcl.cli";

    public static void main(String[] args) {
        String level = System.getenv("SWATCL_DEBUG");
        if (level != null) {
            Debug.get().setThreshold(Debug.parseLevel(level));
            Debug.get().setSink(Debug.stderrSink());
        }
        int status = run(args, new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)),
                System.out, System.err);
        System.exit(status);
    }

    /**
     * @return 0 when every line evaluated, 1 when any line failed, 2 on bad
     *         usage and 3 when the input could not be read
     */
    public static int run(String[] args, BufferedReader stdin, PrintStream out, PrintStream err) {
        boolean json = false;
        Path file = null;
        MapExprHost host = new MapExprHost();

        for (String a : args) {
            if ("--json".equals(a)) {
                json = true;
            } else if (a.startsWith("--")) {
                err.println("Unknown option: " + a);
                err.println("Usage: SwatclExprCli [--json] [name=value ...] [file]");
                return 2;
            } else if (a.indexOf('=') > 0) {
                int i = a.indexOf('=');
                host.setVariable(a.substring(0, i), a.substring(i + 1));
                Debug.get().d(TAG, "set " + a.substring(0, i) + " = " + a.substring(i + 1));
            } else if (file == null) {
                file = Path.of(a);
            } else {
                err.println("Usage: SwatclExprCli [--json] [name=value ...] [file]");
                return 2;
            }
        }

        boolean failed = false;
        try (BufferedReader in = (file == null) ? stdin : Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            int lineNo = 0;
            while ((line = in.readLine()) != null) {
                lineNo++;
                String expr = line.trim();
                if (expr.isEmpty() || expr.startsWith("#")) continue;
                try {
                    if (json) {
                        out.println(ExprTreeJson.toJsonString(host.engine().parse(expr), true));
                    } else {
                        out.println(host.evaluate(expr));
                    }
                } catch (EvalException e) {
                    Debug.get().d(TAG, "line " + lineNo + " failed", e);
                    out.println("error: " + e);
                    failed = true;
                }
            }
        } catch (IOException e) {
            err.println("Failed to read input" + (file == null ? "" : ": " + file));
            e.printStackTrace(err);
            return 3;
        }
        return failed ? 1 : 0;
    }

    private SwatclExprCli() {}
}
