package com.btoropt.cli;

import com.btoropt.compiler.error.Btor2Exception;
import com.btoropt.compiler.model.Btor2Printer;
import com.btoropt.compiler.model.Instruction;
import com.btoropt.compiler.parser.Btor2Parser;
import com.btoropt.compiler.parser.ParseStrategy;
import com.btoropt.ir.miter.MiterBuilder;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * picocli miter 子命令：合并同一设计的两份 BTOR2 用于等价检查
 */
@Command(name = "miter", description = "合并两份 BTOR2 为 miter 电路")
public class MiterCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Parameters(index = "0", description = "第一份 BTOR2 文件")
    Path first;

    @Parameters(index = "1", description = "第二份 BTOR2 文件")
    Path second;

    @Option(names = "--emit", defaultValue = "BTOR2", description = "输出格式：${COMPLETION-CANDIDATES}（默认 btor2）")
    Emit emit;

    @Option(names = {"-v", "--verbose"}, description = "输出调试日志")
    boolean verbose;

    @Override
    public Integer call() {
        CommandSupport.configureLogging(verbose);
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        Path current = first;
        try {
            List<Instruction> a = Btor2Parser.create(ParseStrategy.EAGER).parse(CommandSupport.readLines(first));
            current = second;
            List<Instruction> b = Btor2Parser.create(ParseStrategy.EAGER).parse(CommandSupport.readLines(second));

            List<Instruction> miter = MiterBuilder.merge(a, b);
            out.println(emit == Emit.JSON ? JsonEmitter.toJson(miter) : Btor2Printer.print(miter));
            out.flush();
            return CommandSupport.OK;
        } catch (Btor2Exception e) {
            return CommandSupport.report(err, e);
        } catch (IOException e) {
            return CommandSupport.report(err, e, current);
        }
    }
}
