package com.acme.inventory.cli;

import com.acme.inventory.cli.commands.AccountsCommand;
import com.acme.inventory.cli.commands.CollectCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

@Command(
        name = "inventory",
        description = "Cross-account resource inventory",
        mixinStandardHelpOptions = true,
        version = "1.0.0",
        subcommands = {
                CollectCommand.class,
                AccountsCommand.class
        }
)
public class InventoryCli implements Runnable {

    @Spec
    CommandSpec spec;

    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }

    /** Usage errors exit with 1; exit code 2 is reserved for partially successful collections. */
    public static CommandLine commandLine() {
        CommandLine cmd = new CommandLine(new InventoryCli());
        cmd.setParameterExceptionHandler((ex, args) -> {
            CommandLine failed = ex.getCommandLine();
            failed.getErr().println(ex.getMessage());
            failed.usage(failed.getErr());
            return 1;
        });
        return cmd;
    }

    @Override
    public void run() {
        // no subcommand given
        spec.commandLine().usage(spec.commandLine().getOut());
    }
}
