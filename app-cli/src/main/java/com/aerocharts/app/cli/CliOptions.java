package com.aerocharts.app.cli;

import com.aerocharts.core.model.ChartCategory;

import java.nio.file.Path;
import java.util.Locale;

/**
 * 명령행 인자.
 * aerocharts &lt;ICAO&gt; [-s|--source id] [-c|--category GEN|GND|SID|STAR|APP] [--json]
 *            [--config catalog.yml] [--retries N] [-v|--verbose]
 * aerocharts --list-sources
 */
public final class CliOptions {

    public static final String USAGE = String.join(System.lineSeparator(),
            "Usage: aerocharts <ICAO> [options]",
            "       aerocharts --list-sources",
            "",
            "Options:",
            "  -s, --source <id>        use this source instead of prefix routing",
            "  -c, --category <code>    only GEN, GND, SID, STAR or APP charts",
            "      --json               print JSON instead of text",
            "      --config <file>      source catalog (default: built-in)",
            "      --retries <n>        retry transient failures up to n times (default 0)",
            "  -v, --verbose            debug logging on stderr",
            "      --list-sources       list configured sources and prefixes",
            "  -h, --help               show this help");

    private String identifier;
    private String sourceId;
    private ChartCategory category;
    private boolean json;
    private boolean verbose;
    private Path configPath;
    private int retries;
    private boolean listSources;
    private boolean help;

    private CliOptions() {}

    /** 잘못된 인자는 IllegalArgumentException(메시지는 사용자에게 그대로 보여줌) */
    public static CliOptions parse(String... args) {
        CliOptions o = new CliOptions();
        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            switch (a) {
                case "-s":
                case "--source":
                    o.sourceId = value(args, ++i, a).toLowerCase(Locale.ROOT);
                    break;
                case "-c":
                case "--category":
                    o.category = ChartCategory.parse(value(args, ++i, a));
                    break;
                case "--json":
                    o.json = true;
                    break;
                case "--config":
                    o.configPath = Path.of(value(args, ++i, a));
                    break;
                case "--retries":
                    o.retries = parseRetries(value(args, ++i, a));
                    break;
                case "-v":
                case "--verbose":
                    o.verbose = true;
                    break;
                case "--list-sources":
                    o.listSources = true;
                    break;
                case "-h":
                case "--help":
                    o.help = true;
                    break;
                default:
                    if (a.startsWith("-")) throw new IllegalArgumentException("unknown option: " + a);
                    if (o.identifier != null) throw new IllegalArgumentException("only one airport identifier expected");
                    o.identifier = a.trim().toUpperCase(Locale.ROOT);
            }
        }
        if (!o.help && !o.listSources && (o.identifier == null || o.identifier.isEmpty())) {
            throw new IllegalArgumentException("missing airport identifier");
        }
        return o;
    }

    private static String value(String[] args, int i, String opt) {
        if (i >= args.length || args[i].startsWith("-")) {
            throw new IllegalArgumentException(opt + " needs a value");
        }
        return args[i];
    }

    private static int parseRetries(String v) {
        try {
            int n = Integer.parseInt(v.trim());
            if (n < 0 || n > 10) throw new IllegalArgumentException("--retries must be 0..10");
            return n;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--retries needs a number (was " + v + ")", e);
        }
    }

    public String getIdentifier() { return identifier; }
    public String getSourceId() { return sourceId; }
    /** null이면 전체 */
    public ChartCategory getCategory() { return category; }
    public boolean isJson() { return json; }
    public boolean isVerbose() { return verbose; }
    /** null이면 내장 카탈로그 */
    public Path getConfigPath() { return configPath; }
    public int getRetries() { return retries; }
    public boolean isListSources() { return listSources; }
    public boolean isHelp() { return help; }
}
