package com.btoropt.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * btoropt CLI 入口点（picocli）
 */
@Command(name = "btoropt", version = "btoropt v0.3.0",
         mixinStandardHelpOptions = true,
         subcommands = {OptCommand.class, MiterCommand.class, PassesCommand.class})
public class Main implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        // 没有子命令时打印用法
        spec.commandLine().usage(spec.commandLine().getOut());
    }

    public static CommandLine commandLine() {
        return new CommandLine(new Main()).setCaseInsensitiveEnumValuesAllowed(true);
    }

    public static void main(String[] args) {
        System.exit(commandLine().execute(args));
    }
}
