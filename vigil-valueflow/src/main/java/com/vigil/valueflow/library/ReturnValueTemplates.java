package com.vigil.valueflow.library;

import com.vigil.compiler.TranslationUnit;
import com.vigil.compiler.parser.ParseException;
import com.vigil.valueflow.cache.BoundedCache;
import com.vigil.valueflow.cache.CacheStats;
import com.vigil.valueflow.cache.CaffeineCache;

import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 返回值模板的编译缓存：每个模板字符串只解析一次
 */
public final class ReturnValueTemplates {

    private static final Logger LOG = Logger.getLogger(ReturnValueTemplates.class.getName());

    private final BoundedCache<String, CompiledTemplate> cache;

    public ReturnValueTemplates(long capacity) {
        this(new CaffeineCache<String, CompiledTemplate>(capacity));
    }

    public ReturnValueTemplates(BoundedCache<String, CompiledTemplate> cache) {
        this.cache = cache;
    }

    /**
     * 编译模板；语法错误时返回空（解析失败的结果同样被缓存）
     */
    public Optional<CompiledTemplate> compile(String template) {
        CompiledTemplate compiled = cache.get(template, ReturnValueTemplates::parse);
        return compiled.isValid() ? Optional.of(compiled) : Optional.<CompiledTemplate>empty();
    }

    private static CompiledTemplate parse(String template) {
        CompiledTemplate compiled;
        try {
            compiled = CompiledTemplate.of(template, TranslationUnit.parse("return " + template + ";", "<template>"));
        } catch (ParseException e) {
            LOG.fine("Cannot parse return value template '" + template + "': " + e.getMessage());
            return CompiledTemplate.invalid(template);
        }
        if (!compiled.isValid()) {
            LOG.fine("Empty return value template '" + template + "'");
        }
        return compiled;
    }

    public CacheStats stats() {
        CacheStats stats = cache.stats();
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("Return value template cache: " + stats);
        }
        return stats;
    }

    public void clear() {
        cache.invalidateAll();
    }
}
