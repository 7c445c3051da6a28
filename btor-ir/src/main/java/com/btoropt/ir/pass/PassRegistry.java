package com.btoropt.ir.pass;

import com.btoropt.compiler.error.UnsupportedPassException;
import com.btoropt.ir.pass.transform.ApplyContracts;
import com.btoropt.ir.pass.transform.InitAllStates;
import com.btoropt.ir.pass.transform.RenameInputs;
import com.btoropt.ir.pass.validation.CheckLidOrdering;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pass 注册表：id → pass。
 * <p>
 * 注册表是显式构造的值，由调用方传给管线，不存在进程级的全局列表。
 */
public class PassRegistry {

    private final Map<String, Pass> passes = new LinkedHashMap<>();

    /**
     * 创建包含全部内置 pass 的注册表。
     */
    public static PassRegistry createDefault() {
        PassRegistry registry = new PassRegistry();
        registry.register(new RenameInputs());
        registry.register(new InitAllStates());
        registry.register(new CheckLidOrdering());
        registry.register(new ApplyContracts());
        return registry;
    }

    public void register(Pass pass) {
        if (passes.putIfAbsent(pass.getId(), pass) != null) {
            throw new IllegalArgumentException("Pass id registered twice: " + pass.getId());
        }
    }

    /** 未注册时返回 null */
    public Pass find(String id) {
        return passes.get(id);
    }

    public Collection<Pass> getPasses() {
        return Collections.unmodifiableCollection(passes.values());
    }

    /**
     * 按给定顺序取出 pass。先校验全部 id，任一未注册即失败，不返回部分结果。
     *
     * @throws UnsupportedPassException 第一个未注册的 id
     */
    public List<Pass> resolve(List<String> ids) {
        List<Pass> result = new ArrayList<>(ids.size());
        for (String id : ids) {
            Pass pass = passes.get(id);
            if (pass == null) {
                throw new UnsupportedPassException(id);
            }
            result.add(pass);
        }
        return result;
    }
}
