package com.acme.inventory.cli.commands;

import com.acme.inventory.aws.org.MemberAccount;
import com.acme.inventory.cli.InventoryContext;
import com.acme.inventory.cli.config.TestConfigurations;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.*;

class AccountsCommandTest {

    @TempDir
    Path dir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int run(Function<String, List<MemberAccount>> accountSource, String... args) {
        InventoryContext.Builder context = InventoryContext.builder(TestConfigurations.from(dir))
                .roleAssumer((accountId, roleName, region) -> {
                    throw new UnsupportedOperationException();
                })
                .collectors(StubCollector::new)
                .accountSource(accountSource);
        CommandLine cmd = new CommandLine(new AccountsCommand(context::build));
        cmd.setOut(new PrintWriter(out, true));
        cmd.setErr(new PrintWriter(err, true));
        return cmd.execute(args);
    }

    @Test
    void listsAccountsAsTable() {
        int code = run(ou -> List.of(new MemberAccount("111111111111", "payments-prod", "ACTIVE")), "ou-abc");

        assertThat(code).isZero();
        assertThat(out.toString()).contains("Accounts under ou-abc", "111111111111", "payments-prod", "Total accounts: 1");
    }

    @Test
    void listsAccountsAsJson() {
        run(ou -> List.of(new MemberAccount("111111111111", "payments-prod", "ACTIVE")), "ou-abc", "-f", "json");

        assertThat(out.toString()).contains("\"parentId\"", "\"id\" : \"111111111111\"");
    }

    @Test
    void errorsGoToStderr() {
        int code = run(ou -> {
            throw new IllegalStateException("AWSOrganizationsNotInUseException");
        }, "ou-abc");

        assertThat(code).isEqualTo(1);
        assertThat(err.toString()).contains("Error listing accounts: AWSOrganizationsNotInUseException");
    }
}
