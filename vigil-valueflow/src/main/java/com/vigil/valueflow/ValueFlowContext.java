package com.vigil.valueflow;

import com.vigil.valueflow.infer.BoundInference;
import com.vigil.valueflow.infer.IntervalInference;
import com.vigil.valueflow.library.Library;
import com.vigil.valueflow.library.LibraryModel;
import com.vigil.valueflow.library.ReturnValueTemplates;
import com.vigil.valueflow.oracle.MutationOracle;
import com.vigil.valueflow.oracle.SyntacticMutationOracle;

/**
 * 一次分析共享的协作者：设置、库模型、修改判定、边界推断与模板缓存
 */
public final class ValueFlowContext {

    private final ValueFlowSettings settings;
    private final LibraryModel library;
    private final MutationOracle oracle;
    private final BoundInference inference;
    private final ReturnValueTemplates templates;

    public ValueFlowContext(ValueFlowSettings settings, LibraryModel library, MutationOracle oracle,
                            BoundInference inference, ReturnValueTemplates templates) {
        this.settings = settings;
        this.library = library;
        this.oracle = oracle;
        this.inference = inference;
        this.templates = templates;
    }

    /** 标准库定义与默认实现 */
    public static ValueFlowContext create(ValueFlowSettings settings) {
        return create(settings, Library.standard());
    }

    public static ValueFlowContext create(ValueFlowSettings settings, LibraryModel library) {
        return new ValueFlowContext(settings, library, new SyntacticMutationOracle(library),
                new IntervalInference(), new ReturnValueTemplates(settings.getTemplateCacheSize()));
    }

    public static ValueFlowContext standard() {
        return create(ValueFlowSettings.defaults());
    }

    public ValueFlowSettings getSettings() { return settings; }
    public LibraryModel getLibrary() { return library; }
    public MutationOracle getOracle() { return oracle; }
    public BoundInference getInference() { return inference; }
    public ReturnValueTemplates getTemplates() { return templates; }
}
