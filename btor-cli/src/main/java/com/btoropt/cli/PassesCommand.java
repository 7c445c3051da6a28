package com.btoropt.cli;

import com.btoropt.ir.pass.Pass;
import com.btoropt.ir.pass.PassRegistry;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;

/**
 * picocli passes 子命令：列出可用的 pass id
 */
@Command(name = "passes", description = "列出可用的 pass")
public class PassesCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        PrintWriter out = spec.commandLine().getOut();
        for (Pass pass : PassRegistry.createDefault().getPasses()) {
            out.println(pass.getId());
        }
        out.flush();
    }
}
