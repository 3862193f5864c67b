package com.acme.inventory.cli.commands;

import com.acme.inventory.aws.org.MemberAccount;
import com.acme.inventory.cli.InventoryContext;
import com.acme.inventory.cli.config.InventoryConfiguration;
import com.acme.inventory.config.CollectorConfig;
import com.acme.inventory.core.Jsons;
import com.acme.inventory.lock.ObjectStoreLock;
import com.acme.inventory.model.AccountResult;
import com.acme.inventory.model.AccountTask;
import com.acme.inventory.model.CollectionResult;
import com.acme.inventory.model.CollectionSummary;
import com.acme.inventory.publish.BatchPublishResult;
import com.acme.inventory.publish.FindingPublisher;
import com.acme.inventory.report.CsvReportWriter;
import com.acme.inventory.report.ReportWriteResult;
import com.acme.inventory.resilience.CircuitSnapshot;
import com.acme.inventory.spi.ObjectStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.function.Supplier;

@Command(
        name = "collect",
        description = "Collect one resource type across accounts",
        mixinStandardHelpOptions = true
)
public class CollectCommand implements Callable<Integer> {
    private static final Logger logger = LoggerFactory.getLogger(CollectCommand.class);

    static final int EXIT_SUCCESS = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_PARTIAL = 2;

    @Spec
    CommandSpec spec;

    @Option(names = {"-s", "--service"}, required = true,
            description = "Resource type to collect: iam, kms, ec2, s3 or ami")
    private String service;

    @Option(names = {"-a", "--accounts"}, split = ",", description = "Comma-separated account ids")
    private List<String> accounts;

    @Option(names = "--ou", description = "Collect from every active account under this organizational unit")
    private String organizationalUnit;

    @Option(names = {"-r", "--role"}, description = "Role to assume in each account (default: INVENTORY_ROLE_NAME)")
    private String roleName;

    @Option(names = "--region", description = "Region to scan (default: AWS_REGION)")
    private String region;

    @Option(names = "--max-accounts", description = "Accounts collected in parallel")
    private Integer maxAccounts;

    @Option(names = "--max-resources", description = "Resource details fetched in parallel per account")
    private Integer maxResources;

    @Option(names = "--publish", description = "Publish every collected resource as a finding")
    private boolean publish;

    @Option(names = "--report", description = "Merge collected resources into today's CSV report")
    private boolean report;

    @Option(names = {"-f", "--format"}, description = "Output format: table or json (default: table)",
            defaultValue = "table")
    private String format;

    private final Supplier<InventoryContext> contextFactory;

    public CollectCommand() {
        this(() -> InventoryContext.fromConfiguration(InventoryConfiguration.getInstance()));
    }

    public CollectCommand(Supplier<InventoryContext> contextFactory) {
        this.contextFactory = contextFactory;
    }

    @Override
    public Integer call() {
        PrintWriter err = spec.commandLine().getErr();
        if ((accounts == null || accounts.isEmpty()) == (organizationalUnit == null)) {
            err.println("Specify exactly one of --accounts or --ou");
            return EXIT_FAILURE;
        }

        try (InventoryContext context = contextFactory.get()) {
            CollectorConfig config = context.collectorConfig();
            String role = roleName != null ? roleName : config.getRoleName();
            String scanRegion = region != null ? region : config.getRegion();

            List<AccountTask> tasks = new ArrayList<>();
            for (String accountId : accountIds(context)) {
                tasks.add(new AccountTask(accountId.trim(), role, scanRegion));
            }
            if (tasks.isEmpty()) {
                err.println("No accounts to collect from");
                return EXIT_FAILURE;
            }

            CollectionResult result = context.orchestrator().collect(
                    context.collector(service),
                    tasks,
                    maxAccounts != null ? maxAccounts : config.getMaxAccountConcurrency(),
                    maxResources != null ? maxResources : config.getMaxResourceConcurrency());

            // a failed publish or report must not hide the collection outcome
            Map<String, String> stepErrors = new LinkedHashMap<>();
            BatchPublishResult published = null;
            if (publish) {
                try {
                    published = publish(context, result);
                } catch (RuntimeException e) {
                    logger.warn("Publishing {} findings failed", service, e);
                    stepErrors.put("publish", e.getMessage());
                }
            }
            ReportWriteResult written = null;
            if (report) {
                try {
                    written = writeReport(context, result);
                } catch (RuntimeException e) {
                    logger.warn("Writing the {} report failed", service, e);
                    stepErrors.put("report", e.getMessage());
                }
            }

            if ("json".equalsIgnoreCase(format)) {
                printJson(result, published, written, stepErrors);
            } else {
                printTable(result, published, written);
            }
            stepErrors.forEach((step, message) -> err.println("Error in " + step + " step: " + message));
            return stepErrors.isEmpty() ? exitCode(result.summary()) : EXIT_FAILURE;
        } catch (RuntimeException e) {
            logger.debug("collect {} failed", service, e);
            err.println("Error collecting " + service + ": " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    private List<String> accountIds(InventoryContext context) {
        if (organizationalUnit == null) {
            return accounts;
        }
        List<String> ids = new ArrayList<>();
        for (MemberAccount account : context.accountsUnder(organizationalUnit)) {
            ids.add(account.id());
        }
        return ids;
    }

    private BatchPublishResult publish(InventoryContext context, CollectionResult result) {
        String topic = context.configuration().getPublishTopic();
        FindingPublisher publisher = new FindingPublisher(context.publisher(), context.breakers());
        return publisher.publishResult(topic, result);
    }

    private ReportWriteResult writeReport(InventoryContext context, CollectionResult result) {
        ObjectStore store = context.reportStore();
        CsvReportWriter writer = new CsvReportWriter(
                store, new ObjectStoreLock(store, context.lockConfig()), context.configuration().getReportPrefix());
        return writer.appendResult(result, result.executionId());
    }

    static int exitCode(CollectionSummary summary) {
        if (summary.isTotalFailure()) {
            return EXIT_FAILURE;
        }
        return summary.successfulAccounts() == summary.totalAccounts() ? EXIT_SUCCESS : EXIT_PARTIAL;
    }

    private void printJson(CollectionResult result, BatchPublishResult published, ReportWriteResult written,
                           Map<String, String> stepErrors) {
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("executionId", result.executionId());
        json.put("service", result.service());
        json.put("summary", result.summary());
        json.put("taggingPercentage", result.summary().taggingPercentage());

        List<Map<String, Object>> accountList = new ArrayList<>();
        for (AccountResult account : result.results().values()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("accountId", account.accountId());
            entry.put("status", account.status());
            entry.put("statistics", account.statistics());
            account.failure().ifPresent(f -> entry.put("error", f));
            accountList.add(entry);
        }
        json.put("accounts", accountList);
        json.put("circuits", result.circuits().values());
        if (published != null) {
            json.put("publish", published);
        }
        if (written != null) {
            json.put("report", written);
        }
        if (!stepErrors.isEmpty()) {
            json.put("stepErrors", stepErrors);
        }
        spec.commandLine().getOut().println(Jsons.toPrettyJson(json));
    }

    private void printTable(CollectionResult result, BatchPublishResult published, ReportWriteResult written) {
        PrintWriter out = spec.commandLine().getOut();
        CollectionSummary summary = result.summary();

        out.println("Collection " + result.executionId() + " (" + result.service() + ")");
        out.println("=".repeat(100));
        out.printf("%-14s %-13s %-10s %-8s %-9s %-7s %s%n",
                "Account", "Status", "Resources", "Tagged", "Untagged", "Failed", "Error");
        out.println("-".repeat(100));
        for (AccountResult account : result.results().values()) {
            out.printf("%-14s %-13s %-10d %-8d %-9d %-7d %s%n",
                    account.accountId(),
                    account.status(),
                    account.statistics().total(),
                    account.statistics().tagged(),
                    account.statistics().untagged(),
                    account.statistics().failed(),
                    account.failure().map(f -> f.operation() + " " + f.code() + ": " + f.message()).orElse(""));
        }
        out.println("=".repeat(100));
        out.printf("Accounts: %d total, %d succeeded, %d failed, %d circuit open%n",
                summary.totalAccounts(), summary.successfulAccounts(),
                summary.failedAccounts(), summary.circuitOpenAccounts());
        out.printf("Resources: %d total, %d tagged (%.1f%%), %d untagged, %d failed%n",
                summary.totalResources(), summary.taggedResources(), summary.taggingPercentage(),
                summary.untaggedResources(), summary.failedResources());
        out.printf("Elapsed: %d ms%n", summary.elapsed().toMillis());

        for (CircuitSnapshot circuit : result.circuits().values()) {
            out.printf("Circuit %-20s %-10s failures=%d%n", circuit.name(), circuit.state(), circuit.failureCount());
        }
        if (published != null) {
            out.printf("Published %d/%d findings (%d failed)%n",
                    published.successful(), published.total(), published.failed());
        }
        if (written != null) {
            out.printf("Report %s: %s (%s)%n", written.key(), written.status(), written.message());
        }
    }
}
