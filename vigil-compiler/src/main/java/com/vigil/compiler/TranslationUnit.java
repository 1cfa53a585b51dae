package com.vigil.compiler;

import com.vigil.compiler.analysis.SymbolDatabase;
import com.vigil.compiler.ast.Token;
import com.vigil.compiler.ast.TokenList;
import com.vigil.compiler.parser.ParseException;
import com.vigil.compiler.parser.Parser;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 翻译单元：分词、解析与语义标注后的表达式图
 */
public final class TranslationUnit {

    private static final Logger LOG = Logger.getLogger(TranslationUnit.class.getName());

    private final TokenList tokens;
    private final SymbolDatabase symbols;

    private TranslationUnit(TokenList tokens, SymbolDatabase symbols) {
        this.tokens = tokens;
        this.symbols = symbols;
    }

    public static TranslationUnit parse(String source) {
        return parse(source, "<input>");
    }

    /**
     * @throws ParseException 源码无法构成表达式图
     */
    public static TranslationUnit parse(String source, String fileName) {
        TokenList tokens = TokenList.tokenize(source, fileName);
        SymbolDatabase symbols = new Parser(tokens).parse();
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine(String.format("%s: %d tokens, %d scopes, %d variables",
                    fileName, tokens.size(), symbols.getScopeList().size(), symbols.getVariableCount()));
        }
        return new TranslationUnit(tokens, symbols);
    }

    public TokenList getTokenList() { return tokens; }
    public SymbolDatabase getSymbolDatabase() { return symbols; }

    /** 第一个匹配模式的 token，找不到时抛出异常 */
    public Token find(String pattern) {
        Token tok = tokens.findFirst(pattern);
        if (tok == null) {
            throw new IllegalArgumentException("No token matches '" + pattern + "' in " + tokens.getFileName());
        }
        return tok;
    }

    /** 最后一个匹配模式的 token */
    public Token findLast(String pattern) {
        Token tok = tokens.findLast(pattern);
        if (tok == null) {
            throw new IllegalArgumentException("No token matches '" + pattern + "' in " + tokens.getFileName());
        }
        return tok;
    }
}
