package com.btoropt.cli;

import com.btoropt.compiler.error.Btor2Exception;
import com.btoropt.compiler.model.Btor2Printer;
import com.btoropt.compiler.model.Instruction;
import com.btoropt.compiler.model.Program;
import com.btoropt.compiler.parser.Btor2Parser;
import com.btoropt.compiler.parser.ModularParser;
import com.btoropt.compiler.parser.ParseStrategy;
import com.btoropt.ir.pass.PassPipeline;
import com.btoropt.ir.pass.PassRegistry;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ForkJoinPool;

/**
 * picocli opt 子命令：解析 BTOR2 文件，依次执行给定的 pass，打印结果
 */
@Command(name = "opt", description = "解析 BTOR2 文件并执行 pass")
public class OptCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Parameters(index = "0", description = "BTOR2 文件路径")
    Path file;

    @Parameters(index = "1..*", arity = "0..*", description = "按顺序执行的 pass id")
    List<String> passIds = new ArrayList<>();

    @Option(names = "--modular", description = "按模块化 BTOR2 解析（module / contract 块）")
    boolean modular;

    @Option(names = "--strategy", defaultValue = "EAGER", description = "操作数解析策略：${COMPLETION-CANDIDATES}（默认 eager）")
    ParseStrategy strategy;

    @Option(names = "--emit", defaultValue = "BTOR2", description = "输出格式：${COMPLETION-CANDIDATES}（默认 btor2）")
    Emit emit;

    @Option(names = "--threads", description = "模块级 pass 的并行线程数（默认使用公共 ForkJoinPool）")
    Integer threads;

    @Option(names = {"-v", "--verbose"}, description = "输出 pass 执行日志")
    boolean verbose;

    @Override
    public Integer call() {
        CommandSupport.configureLogging(verbose);
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        ExecutorService pool = threads != null ? Executors.newFixedThreadPool(Math.max(1, threads)) : null;
        try {
            // 先校验全部 pass id，再读取文件
            PassPipeline pipeline = PassPipeline.resolve(PassRegistry.createDefault(), passIds,
                    pool != null ? pool : ForkJoinPool.commonPool());
            List<String> lines = CommandSupport.readLines(file);

            if (modular) {
                Program program = pipeline.run(new ModularParser(strategy).parse(lines));
                out.println(emit == Emit.JSON ? JsonEmitter.toJson(program) : Btor2Printer.print(program));
            } else {
                List<Instruction> instructions = pipeline.run(Btor2Parser.create(strategy).parse(lines));
                out.println(emit == Emit.JSON ? JsonEmitter.toJson(instructions) : Btor2Printer.print(instructions));
            }
            out.flush();
            return CommandSupport.OK;
        } catch (Btor2Exception e) {
            return CommandSupport.report(err, e);
        } catch (IOException e) {
            return CommandSupport.report(err, e, file);
        } finally {
            if (pool != null) pool.shutdown();
        }
    }
}
