package com.btoropt.ir.pass;

import com.btoropt.compiler.model.Btor2Printer;
import com.btoropt.compiler.model.Instruction;
import com.btoropt.compiler.model.Program;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.logging.Logger;

/**
 * Pass 管线：按顺序执行一组 pass。
 * <p>
 * 构造时所有 pass 已经解析完毕，因此管线一旦开始执行就不会因为未知 id 而中途失败。
 * 任一 pass 抛出异常即中止整个管线。
 */
public class PassPipeline {

    private static final Logger LOG = Logger.getLogger(PassPipeline.class.getName());

    private final List<Pass> passes;
    private final Executor executor;

    public PassPipeline(List<Pass> passes, Executor executor) {
        this.passes = Collections.unmodifiableList(new ArrayList<>(passes));
        this.executor = executor;
    }

    /**
     * 从注册表解析 pass id 并创建管线（模块级并行使用公共 ForkJoinPool）。
     *
     * @throws com.btoropt.compiler.error.UnsupportedPassException 任一 id 未注册
     */
    public static PassPipeline resolve(PassRegistry registry, List<String> ids) {
        return new PassPipeline(registry.resolve(ids), ForkJoinPool.commonPool());
    }

    public static PassPipeline resolve(PassRegistry registry, List<String> ids, Executor executor) {
        return new PassPipeline(registry.resolve(ids), executor);
    }

    public List<Pass> getPasses() { return passes; }

    public List<Instruction> run(List<Instruction> instructions) {
        List<Instruction> current = instructions;
        for (Pass pass : passes) {
            LOG.fine(() -> "Running pass " + pass.getId());
            current = pass.run(current);
            if (dumpEnabled()) {
                System.err.println("===== after " + pass.getId() + " =====");
                System.err.println(Btor2Printer.print(current));
            }
        }
        return current;
    }

    public Program run(Program program) {
        Program current = program;
        for (Pass pass : passes) {
            Program input = current;
            LOG.fine(() -> "Running pass " + pass.getId() + " on " + input.getModules().size() + " modules");
            current = pass.runOnProgram(current, executor);
            if (dumpEnabled()) {
                System.err.println("===== after " + pass.getId() + " =====");
                System.err.println(Btor2Printer.print(current));
            }
        }
        return current;
    }

    // 中间结果 dump（设置 BTOROPT_DUMP_PASSES=1 环境变量启用）
    private static boolean dumpEnabled() {
        return "1".equals(System.getenv("BTOROPT_DUMP_PASSES"));
    }
}
