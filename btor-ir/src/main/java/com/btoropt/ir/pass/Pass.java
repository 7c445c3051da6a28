package com.btoropt.ir.pass;

import com.btoropt.compiler.model.Instruction;
import com.btoropt.compiler.model.Module;
import com.btoropt.compiler.model.Program;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * BTOR2 pass 接口。
 */
public interface Pass {

    /**
     * Pass 的唯一 id（命令行中使用）。
     */
    String getId();

    /**
     * 变换平坦指令序列。实现不得修改传入的列表。
     */
    List<Instruction> run(List<Instruction> instructions);

    /**
     * 变换模块化程序。
     * <p>
     * 默认把 {@link #run(List)} 分别作用于每个模块体：各模块在 executor 上并行执行，
     * 结果按模块原顺序收集，契约保持不变。
     */
    default Program runOnProgram(Program program, Executor executor) {
        List<CompletableFuture<Module>> futures = new ArrayList<>();
        for (Module module : program.getModules()) {
            futures.add(CompletableFuture.supplyAsync(() -> module.withBody(run(module.getBody())), executor));
        }
        return program.withModules(ModuleFanOut.gather(futures));
    }
}
