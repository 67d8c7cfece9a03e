package com.aerocharts.app.cli;

import com.aerocharts.app.logging.LogSetup;
import com.aerocharts.core.api.IChartResolver;
import com.aerocharts.core.config.SourceCatalog;
import com.aerocharts.core.config.SourceCatalogLoader;
import com.aerocharts.core.error.ChartSourceException;
import com.aerocharts.core.model.ChartsResult;
import com.aerocharts.core.model.SourceInfo;
import com.aerocharts.core.retry.DefaultRetryPolicy;
import com.aerocharts.core.service.ChartResolutionService;
import com.aerocharts.core.service.RetryingChartResolver;
import com.aerocharts.core.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * 명령행 진입점.
 * stdout: 결과(텍스트/JSON), stderr: 오류 메시지 + 로그.
 */
public final class ChartsCli {
    private static final Logger LOG = LoggerFactory.getLogger(ChartsCli.class);

    private final Function<SourceCatalog, ChartResolutionService> serviceFactory;
    private final ChartsPrinter printer = new ChartsPrinter();

    public ChartsCli() {
        this(c -> new ChartResolutionService(c.registry(), c.getConfig()));
    }

    /** 테스트용: 서비스 생성 주입 */
    public ChartsCli(Function<SourceCatalog, ChartResolutionService> serviceFactory) {
        this.serviceFactory = Objects.requireNonNull(serviceFactory, "serviceFactory");
    }

    public static void main(String[] args) {
        Thread.setDefaultUncaughtExceptionHandler((t, e) ->
                LOG.error("==== Uncaught: {} ====", t.getName(), e));
        int code = new ChartsCli().run(args, System.out, System.err);
        System.exit(code);
    }

    public int run(String[] args, PrintStream out, PrintStream err) {
        CliOptions opts;
        try {
            opts = CliOptions.parse(args);
        } catch (IllegalArgumentException e) {
            err.println("error: " + e.getMessage());
            err.println(CliOptions.USAGE);
            return ExitCode.USAGE.code();
        }
        if (opts.isHelp()) {
            out.println(CliOptions.USAGE);
            return ExitCode.OK.code();
        }

        LogSetup.init(opts.isVerbose());

        SourceCatalog catalog;
        try {
            catalog = opts.getConfigPath() == null
                    ? SourceCatalogLoader.loadDefault()
                    : SourceCatalogLoader.load(opts.getConfigPath());
        } catch (IOException | IllegalArgumentException e) {
            err.println("error: cannot load source catalog: " + e.getMessage());
            return ExitCode.USAGE.code();
        }

        if (opts.isListSources()) {
            List<SourceInfo> sources = catalog.registry().sources();
            if (opts.isJson()) printer.printSourcesJson(sources, out);
            else printer.printSources(sources, out);
            return ExitCode.OK.code();
        }

        try (ChartResolutionService service = serviceFactory.apply(catalog)) {
            IChartResolver resolver = opts.getRetries() > 0
                    ? new RetryingChartResolver(service,
                            new DefaultRetryPolicy(opts.getRetries() + 1, 500), Sleeper.system())
                    : service;
            return resolveAndPrint(resolver, opts, out, err);
        }
    }

    private int resolveAndPrint(IChartResolver resolver, CliOptions opts, PrintStream out, PrintStream err) {
        ChartsResult result;
        try {
            result = resolver.resolve(opts.getIdentifier(), opts.getSourceId());
        } catch (ChartSourceException e) {
            LOG.debug("resolve failed: {}", e.toString(), e);
            err.println(ChartsPrinter.failureMessage(e));
            return ExitCode.forFailure(e.kind()).code();
        }

        ChartsResult shown = opts.getCategory() == null ? result : result.only(opts.getCategory());

        if (opts.isJson()) printer.printJson(shown, out);
        else if (!shown.isEmpty()) printer.printText(shown, out);

        if (shown.isEmpty()) {
            err.println(result.isEmpty()
                    ? ChartsPrinter.noChartsMessage(result)
                    : ChartsPrinter.noChartsInCategoryMessage(result, opts.getCategory()));
            return ExitCode.NO_CHARTS.code();
        }
        return ExitCode.OK.code();
    }
}
