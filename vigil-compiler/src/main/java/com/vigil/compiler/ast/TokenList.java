package com.vigil.compiler.ast;

import com.vigil.compiler.lexer.Lexer;
import com.vigil.compiler.lexer.TokenType;
import com.vigil.compiler.parser.ParseException;

import java.io.PrintStream;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * 表达式图节点的 arena
 *
 * <p>持有一个翻译单元的全部 {@link Token}，负责 next/previous/index 链与括号配对，
 * 并把控制语句的单语句体规范化为花括号块。</p>
 */
public final class TokenList implements Iterable<Token> {

    private final String fileName;
    private final List<Token> tokens = new ArrayList<Token>();

    public TokenList(String fileName) {
        this.fileName = fileName;
    }

    /**
     * 词法分析并建立链接
     *
     * @throws ParseException 存在非法字符或括号不配对
     */
    public static TokenList tokenize(String source, String fileName) {
        return tokenize(source, fileName, System.err);
    }

    public static TokenList tokenize(String source, String fileName, PrintStream errStream) {
        TokenList list = new TokenList(fileName);
        for (Token tok : new Lexer(source, fileName, errStream).scanTokens()) {
            if (tok.is(TokenType.EOF)) {
                continue;
            }
            if (tok.is(TokenType.ERROR)) {
                throw new ParseException(tok.getStrValue(), tok);
            }
            list.tokens.add(tok);
        }
        list.relink();
        list.createLinks();
        list.addBraces();
        return list;
    }

    public String getFileName() { return fileName; }

    public Token front() {
        return tokens.isEmpty() ? null : tokens.get(0);
    }

    public Token back() {
        return tokens.isEmpty() ? null : tokens.get(tokens.size() - 1);
    }

    public Token get(int index) {
        return tokens.get(index);
    }

    public int size() {
        return tokens.size();
    }

    public List<Token> getTokens() {
        return Collections.unmodifiableList(tokens);
    }

    @Override
    public Iterator<Token> iterator() {
        return getTokens().iterator();
    }

    // ============ 查找 ============

    /** 第一个匹配模式的节点，模式语法见 {@link Token#match} */
    public Token findFirst(String pattern) {
        for (Token tok : tokens) {
            if (Token.match(tok, pattern)) return tok;
        }
        return null;
    }

    public Token findLast(String pattern) {
        for (int i = tokens.size() - 1; i >= 0; i--) {
            if (Token.match(tokens.get(i), pattern)) return tokens.get(i);
        }
        return null;
    }

    public List<Token> findAll(String pattern) {
        List<Token> result = new ArrayList<Token>();
        for (Token tok : tokens) {
            if (Token.match(tok, pattern)) result.add(tok);
        }
        return result;
    }

    // ============ 链接 ============

    private void relink() {
        Token prev = null;
        for (int i = 0; i < tokens.size(); i++) {
            Token tok = tokens.get(i);
            tok.setIndex(i);
            tok.setPrevious(prev);
            tok.setNext(null);
            if (prev != null) {
                prev.setNext(tok);
            }
            prev = tok;
        }
    }

    private void createLinks() {
        Deque<Token> stack = new ArrayDeque<Token>();
        for (Token tok : tokens) {
            switch (tok.getType()) {
                case LPAREN:
                case LBRACKET:
                case LBRACE:
                    stack.push(tok);
                    break;
                case RPAREN:
                    closeLink(stack, tok, TokenType.LPAREN);
                    break;
                case RBRACKET:
                    closeLink(stack, tok, TokenType.LBRACKET);
                    break;
                case RBRACE:
                    closeLink(stack, tok, TokenType.LBRACE);
                    break;
                default:
                    break;
            }
        }
        if (!stack.isEmpty()) {
            throw new ParseException("Unmatched '" + stack.peek().getStr() + "'", stack.peek());
        }
    }

    private static void closeLink(Deque<Token> stack, Token closer, TokenType opener) {
        if (stack.isEmpty() || !stack.peek().is(opener)) {
            throw new ParseException("Unmatched '" + closer.getStr() + "'", closer);
        }
        Token open = stack.pop();
        open.setLink(closer);
        closer.setLink(open);
    }

    // ============ 花括号规范化 ============

    /**
     * if/else/for/while/do 的单语句体包成块：{@code if (a) x = 1;} 变为 {@code if (a) { x = 1; }}，
     * {@code else if} 变为 {@code else { if ... }}
     */
    private void addBraces() {
        for (int i = 0; i < tokens.size(); i++) {
            Token tok = tokens.get(i);
            Token bodyStart = null;
            if (tok.isOneOf(TokenType.KW_IF, TokenType.KW_FOR, TokenType.KW_WHILE)) {
                if (tok.is(TokenType.KW_WHILE) && isDoWhileTrailer(tok)) {
                    continue;
                }
                Token paren = tok.getNext();
                if (paren == null || !paren.is(TokenType.LPAREN)) {
                    throw new ParseException("Expected '(' after '" + tok.getStr() + "'", paren != null ? paren : tok);
                }
                bodyStart = paren.getLink().getNext();
            } else if (tok.isOneOf(TokenType.KW_ELSE, TokenType.KW_DO)) {
                bodyStart = tok.getNext();
            }
            if (bodyStart == null) {
                if (tok.isOneOf(TokenType.KW_IF, TokenType.KW_FOR, TokenType.KW_WHILE,
                        TokenType.KW_ELSE, TokenType.KW_DO)) {
                    throw new ParseException("Missing statement body", tok);
                }
                continue;
            }
            if (bodyStart.is(TokenType.LBRACE)) {
                continue;
            }
            Token end = findStatementEnd(bodyStart);
            int startIndex = bodyStart.getIndex();
            int endIndex = end.getIndex();
            tokens.add(endIndex + 1, new Token(TokenType.RBRACE, "}", end.getLine(), end.getColumn() + 1));
            tokens.add(startIndex, new Token(TokenType.LBRACE, "{", bodyStart.getLine(), bodyStart.getColumn()));
            relink();
            createLinks();
        }
    }

    private static boolean isDoWhileTrailer(Token whileTok) {
        Token prev = whileTok.getPrevious();
        return prev != null && prev.is(TokenType.RBRACE) && prev.getLink() != null
                && prev.getLink().getPrevious() != null && prev.getLink().getPrevious().is(TokenType.KW_DO);
    }

    /** 语句的最后一个 token（块的 '}' 或结尾的 ';'） */
    private Token findStatementEnd(Token tok) {
        if (tok == null) {
            throw new ParseException("Unexpected end of input", back());
        }
        switch (tok.getType()) {
            case LBRACE:
                return tok.getLink();
            case KW_IF: {
                Token end = findStatementEnd(parenBodyStart(tok));
                Token after = end.getNext();
                if (after != null && after.is(TokenType.KW_ELSE)) {
                    return findStatementEnd(after.getNext());
                }
                return end;
            }
            case KW_FOR:
            case KW_WHILE:
                return findStatementEnd(parenBodyStart(tok));
            case KW_DO: {
                Token end = findStatementEnd(tok.getNext());
                Token whileTok = end.getNext();
                if (whileTok == null || !whileTok.is(TokenType.KW_WHILE)) {
                    throw new ParseException("Expected 'while' after do body", whileTok != null ? whileTok : end);
                }
                Token semi = parenBodyStart(whileTok);
                if (semi == null || !semi.is(TokenType.SEMICOLON)) {
                    throw new ParseException("Expected ';' after do-while", semi != null ? semi : whileTok);
                }
                return semi;
            }
            default:
                for (Token t = tok; t != null; t = t.getNext()) {
                    if (t.isOneOf(TokenType.LPAREN, TokenType.LBRACKET, TokenType.LBRACE)) {
                        t = t.getLink();
                    } else if (t.is(TokenType.SEMICOLON)) {
                        return t;
                    } else if (t.is(TokenType.RBRACE)) {
                        throw new ParseException("Expected ';'", t);
                    }
                }
                throw new ParseException("Expected ';'", back());
        }
    }

    private static Token parenBodyStart(Token keyword) {
        Token paren = keyword.getNext();
        if (paren == null || !paren.is(TokenType.LPAREN)) {
            throw new ParseException("Expected '(' after '" + keyword.getStr() + "'", paren != null ? paren : keyword);
        }
        return paren.getLink().getNext();
    }
}
