package com.yuzhi.dts.iac.cli;

import com.yuzhi.dts.iac.config.IacProperties;
import com.yuzhi.dts.iac.service.ReconciliationPlan;
import com.yuzhi.dts.iac.service.ReconciliationService;
import com.yuzhi.dts.iac.service.config.ConfigLoadException;
import com.yuzhi.dts.iac.service.config.DesiredConfigLoader;
import com.yuzhi.dts.iac.service.report.ApplyReport;
import com.yuzhi.dts.iac.service.report.ChangeReportFormatter;
import com.yuzhi.dts.iac.service.validation.ConfigValidationException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

/**
 * Command line entry: {@code --check} prints the plan, {@code --apply} prints it and executes it.
 * {@code --config-dir=<dir>} overrides {@code dts.iac.config-dir}. Exit code 1 on bad arguments, invalid config or
 * any failed kind or item.
 */
@Component
public class IacCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger LOG = LoggerFactory.getLogger(IacCommandRunner.class);

    static final int OK = 0;
    static final int FAILED = 1;

    private final DesiredConfigLoader loader;
    private final ReconciliationService reconciliationService;
    private final ChangeReportFormatter formatter;
    private final IacProperties properties;
    private final PrintStream out;
    private int exitCode = OK;

    public IacCommandRunner(
        DesiredConfigLoader loader,
        ReconciliationService reconciliationService,
        ChangeReportFormatter formatter,
        IacProperties properties
    ) {
        this(loader, reconciliationService, formatter, properties, System.out);
    }

    IacCommandRunner(
        DesiredConfigLoader loader,
        ReconciliationService reconciliationService,
        ChangeReportFormatter formatter,
        IacProperties properties,
        PrintStream out
    ) {
        this.loader = loader;
        this.reconciliationService = reconciliationService;
        this.formatter = formatter;
        this.properties = properties;
        this.out = out;
    }

    @Override
    public void run(ApplicationArguments args) {
        exitCode = execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    int execute(ApplicationArguments args) {
        boolean check = args.containsOption("check");
        boolean apply = args.containsOption("apply");
        if (check == apply) {
            LOG.error("Specify exactly one of --check or --apply");
            return FAILED;
        }
        Path configDir = Path.of(configDir(args));
        ReconciliationPlan plan;
        try {
            plan = reconciliationService.plan(loader.load(configDir));
        } catch (ConfigLoadException | ConfigValidationException ex) {
            LOG.error(ex.getMessage());
            return FAILED;
        }
        out.print(formatter.renderPlan(plan.getReports()));
        if (check) {
            return plan.hasProblems() ? FAILED : OK;
        }
        if (plan.isEmpty()) {
            out.println("\nNothing to apply.");
            return plan.hasProblems() ? FAILED : OK;
        }
        ApplyReport report = reconciliationService.apply(plan);
        out.print(formatter.renderApply(report));
        return plan.hasProblems() || report.hasFailures() ? FAILED : OK;
    }

    private String configDir(ApplicationArguments args) {
        List<String> values = args.getOptionValues("config-dir");
        if (values != null && !values.isEmpty() && !values.get(0).isBlank()) {
            return values.get(0);
        }
        return properties.getConfigDir();
    }
}
