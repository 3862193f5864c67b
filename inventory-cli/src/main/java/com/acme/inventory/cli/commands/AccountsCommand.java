package com.acme.inventory.cli.commands;

import com.acme.inventory.aws.org.MemberAccount;
import com.acme.inventory.cli.InventoryContext;
import com.acme.inventory.cli.config.InventoryConfiguration;
import com.acme.inventory.core.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.function.Supplier;

@Command(
        name = "accounts",
        description = "List the active accounts under an organizational unit",
        mixinStandardHelpOptions = true
)
public class AccountsCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Parameters(index = "0", description = "Organizational unit or root id, e.g. ou-ab12-cdef3456")
    private String organizationalUnit;

    @Option(names = {"-f", "--format"}, description = "Output format: table or json (default: table)",
            defaultValue = "table")
    private String format;

    private final Supplier<InventoryContext> contextFactory;

    public AccountsCommand() {
        this(() -> InventoryContext.fromConfiguration(InventoryConfiguration.getInstance()));
    }

    public AccountsCommand(Supplier<InventoryContext> contextFactory) {
        this.contextFactory = contextFactory;
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        try (InventoryContext context = contextFactory.get()) {
            List<MemberAccount> accounts = context.accountsUnder(organizationalUnit);

            if ("json".equalsIgnoreCase(format)) {
                out.println(Jsons.toPrettyJson(Map.of("parentId", organizationalUnit, "accounts", accounts)));
                return 0;
            }
            if (accounts.isEmpty()) {
                out.println("No active accounts under " + organizationalUnit + ".");
                return 0;
            }
            out.println("Accounts under " + organizationalUnit);
            out.println("=".repeat(70));
            out.printf("%-14s %-40s %-10s%n", "Account", "Name", "Status");
            out.println("-".repeat(70));
            for (MemberAccount account : accounts) {
                out.printf("%-14s %-40s %-10s%n", account.id(), account.name(), account.status());
            }
            out.println("=".repeat(70));
            out.println("Total accounts: " + accounts.size());
            return 0;
        } catch (RuntimeException e) {
            spec.commandLine().getErr().println("Error listing accounts: " + e.getMessage());
            return 1;
        }
    }
}
