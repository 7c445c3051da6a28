package com.btoropt.compiler.parser;

import com.btoropt.compiler.model.Module;

/**
 * 解析 inst / ref 时按名字查找已定义的模块。
 */
@FunctionalInterface
public interface ModuleScope {

    /** 名字未定义时返回 null */
    Module findModule(String name);

    /** 不含任何模块的作用域（平坦 BTOR2） */
    ModuleScope EMPTY = name -> null;
}
