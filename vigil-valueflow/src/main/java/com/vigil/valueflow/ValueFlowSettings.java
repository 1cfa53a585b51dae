package com.vigil.valueflow;

/**
 * 值流分析的预算与开关
 *
 * <p>使用示例：</p>
 * <pre>
 * ValueFlowSettings settings = ValueFlowSettings.custom()
 *     .maxExpressionDepth(16)
 *     .invalidateReferenceArguments(false)
 *     .build();
 * </pre>
 */
public final class ValueFlowSettings {

    /** 预设级别 */
    public enum Level { DEFAULT, STRICT, CUSTOM }

    private final Level level;

    // --- 求值预算 ---
    private final int maxExpressionDepth;
    private final int maxFunctionDepth;
    private final int maxNodeVisits;

    // --- 多条件推理 ---
    private final int maxConditionNodes;
    private final int maxConditionLeaves;

    private final long templateCacheSize;
    private final boolean invalidateReferenceArguments;

    private ValueFlowSettings(Builder builder) {
        this.level = builder.level;
        this.maxExpressionDepth = builder.maxExpressionDepth;
        this.maxFunctionDepth = builder.maxFunctionDepth;
        this.maxNodeVisits = builder.maxNodeVisits;
        this.maxConditionNodes = builder.maxConditionNodes;
        this.maxConditionLeaves = builder.maxConditionLeaves;
        this.templateCacheSize = builder.templateCacheSize;
        this.invalidateReferenceArguments = builder.invalidateReferenceArguments;
    }

    // ============ 预设 ============

    private static final ValueFlowSettings DEFAULTS = new Builder(Level.DEFAULT).build();

    public static ValueFlowSettings defaults() {
        return DEFAULTS;
    }

    /** 更小的预算，用于大型输入 */
    public static ValueFlowSettings strict() {
        return new Builder(Level.STRICT)
                .maxExpressionDepth(6)
                .maxFunctionDepth(1)
                .maxNodeVisits(2_000)
                .maxConditionNodes(20)
                .maxConditionLeaves(2)
                .templateCacheSize(64)
                .build();
    }

    public static Builder custom() {
        return new Builder(Level.CUSTOM);
    }

    /** 以当前设置为起点的 Builder */
    public Builder toBuilder() {
        return new Builder(Level.CUSTOM)
                .maxExpressionDepth(maxExpressionDepth)
                .maxFunctionDepth(maxFunctionDepth)
                .maxNodeVisits(maxNodeVisits)
                .maxConditionNodes(maxConditionNodes)
                .maxConditionLeaves(maxConditionLeaves)
                .templateCacheSize(templateCacheSize)
                .invalidateReferenceArguments(invalidateReferenceArguments);
    }

    // ============ 查询方法 ============

    public Level getLevel() { return level; }

    /** 表达式嵌套深度 */
    public int getMaxExpressionDepth() { return maxExpressionDepth; }

    /** 用户函数内联深度 */
    public int getMaxFunctionDepth() { return maxFunctionDepth; }

    /** 单次查询访问节点总数 */
    public int getMaxNodeVisits() { return maxNodeVisits; }

    /** 多条件表达式的节点上限 */
    public int getMaxConditionNodes() { return maxConditionNodes; }

    /** 与已存条件比对时的叶子上限 */
    public int getMaxConditionLeaves() { return maxConditionLeaves; }

    public long getTemplateCacheSize() { return templateCacheSize; }

    /** 内联调用后使引用/指针实参失效 */
    public boolean isInvalidateReferenceArguments() { return invalidateReferenceArguments; }

    @Override
    public String toString() {
        return "ValueFlowSettings{" + level
                + ", depth=" + maxExpressionDepth
                + ", fdepth=" + maxFunctionDepth
                + ", visits=" + maxNodeVisits
                + ", condNodes=" + maxConditionNodes
                + ", condLeaves=" + maxConditionLeaves
                + ", templates=" + templateCacheSize
                + ", invalidateRefs=" + invalidateReferenceArguments + '}';
    }

    // ============ Builder ============

    public static final class Builder {
        private final Level level;
        private int maxExpressionDepth = 10;
        private int maxFunctionDepth = 4;
        private int maxNodeVisits = 10_000;
        private int maxConditionNodes = 50;
        private int maxConditionLeaves = 4;
        private long templateCacheSize = 256;
        private boolean invalidateReferenceArguments = true;

        Builder(Level level) {
            this.level = level;
        }

        public Builder maxExpressionDepth(int depth) {
            this.maxExpressionDepth = requirePositive("maxExpressionDepth", depth);
            return this;
        }

        /** 0 表示不内联 */
        public Builder maxFunctionDepth(int depth) {
            if (depth < 0) {
                throw new IllegalArgumentException("maxFunctionDepth must not be negative: " + depth);
            }
            this.maxFunctionDepth = depth;
            return this;
        }

        public Builder maxNodeVisits(int visits) {
            this.maxNodeVisits = requirePositive("maxNodeVisits", visits);
            return this;
        }

        public Builder maxConditionNodes(int nodes) {
            this.maxConditionNodes = requirePositive("maxConditionNodes", nodes);
            return this;
        }

        public Builder maxConditionLeaves(int leaves) {
            this.maxConditionLeaves = requirePositive("maxConditionLeaves", leaves);
            return this;
        }

        public Builder templateCacheSize(long size) {
            if (size <= 0) {
                throw new IllegalArgumentException("templateCacheSize must be positive: " + size);
            }
            this.templateCacheSize = size;
            return this;
        }

        public Builder invalidateReferenceArguments(boolean invalidate) {
            this.invalidateReferenceArguments = invalidate;
            return this;
        }

        public ValueFlowSettings build() {
            return new ValueFlowSettings(this);
        }

        private static int requirePositive(String name, int value) {
            if (value <= 0) {
                throw new IllegalArgumentException(name + " must be positive: " + value);
            }
            return value;
        }
    }
}
