package kiokundictcli;

import picocli.CommandLine;
import picocli.CommandLine.Command;

@Command(
        name = "kiokun",
        mixinStandardHelpOptions = true,
        version = "1.0.0",
        description = "\033[1;34mBuild the merged Chinese/Japanese dictionary corpus\033[0m",
        subcommands = {
                MappingCommand.class,
                BuildCommand.class,
                ShardCommand.class,
                InspectCommand.class,
                VerifyCommand.class
        }
)
public class Main implements Runnable {

    @Override
    public void run() {
        // Called when no subcommand is provided
        System.out.println("Use --help or a subcommand (mapping / build / shard / inspect / verify)");
    }

    static CommandLine commandLine() {
        return new CommandLine(new Main());
    }

    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
