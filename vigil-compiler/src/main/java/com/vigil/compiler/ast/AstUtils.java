package com.vigil.compiler.ast;

import com.vigil.compiler.lexer.TokenType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;

/**
 * 表达式图上的通用查询
 */
public final class AstUtils {

    private AstUtils() {}

    /** 先序遍历子树 */
    public static void forEach(Token root, Consumer<Token> action) {
        if (root == null) return;
        action.accept(root);
        forEach(root.getAstOperand1(), action);
        forEach(root.getAstOperand2(), action);
    }

    /** 后序遍历子树 */
    public static void forEachPostOrder(Token root, Consumer<Token> action) {
        if (root == null) return;
        forEachPostOrder(root.getAstOperand1(), action);
        forEachPostOrder(root.getAstOperand2(), action);
        action.accept(root);
    }

    /**
     * 按运算符展开：{@code a && b && c} 以 "&&" 展开得到 [a, b, c]
     */
    public static List<Token> astFlatten(Token tok, String op) {
        List<Token> result = new ArrayList<Token>();
        flatten(tok, op, result);
        return result;
    }

    private static void flatten(Token tok, String op, List<Token> out) {
        if (tok == null) return;
        if (tok.getStr().equals(op) && (tok.getAstOperand1() != null || tok.getAstOperand2() != null)) {
            flatten(tok.getAstOperand1(), op, out);
            flatten(tok.getAstOperand2(), op, out);
            return;
        }
        out.add(tok);
    }

    public static int astCount(Token tok, String op) {
        return astCount(tok, op, 100);
    }

    /** 以 op 连接的叶子数；嵌套过深时返回 {@link Short#MAX_VALUE} */
    public static int astCount(Token tok, String op, int depth) {
        if (tok == null) return 0;
        if (depth < 0) return Short.MAX_VALUE;
        if (tok.getStr().equals(op)) {
            return astCount(tok.getAstOperand1(), op, depth - 1) + astCount(tok.getAstOperand2(), op, depth - 1);
        }
        return 1;
    }

    /** 子树中是否包含指定表达式标识 */
    public static boolean astHasExpr(Token tok, int exprId) {
        if (tok == null) return false;
        if (tok.getExprId() == exprId) return true;
        return astHasExpr(tok.getAstOperand1(), exprId) || astHasExpr(tok.getAstOperand2(), exprId);
    }

    public static boolean astHasVar(Token tok, int varId) {
        if (tok == null) return false;
        if (tok.getVarId() == varId) return true;
        return astHasVar(tok.getAstOperand1(), varId) || astHasVar(tok.getAstOperand2(), varId);
    }

    // ============ 位置 ============

    public static boolean precedes(Token a, Token b) {
        if (a == null || b == null) return false;
        return a.getIndex() < b.getIndex();
    }

    public static boolean succeeds(Token a, Token b) {
        if (a == null || b == null) return false;
        return a.getIndex() > b.getIndex();
    }

    /**
     * 子树最右叶子之后的 token；子树内的括号以及包裹子树的分组括号一并跳过
     */
    public static Token nextAfterAstRightmostLeaf(Token tok) {
        if (tok == null) return null;
        int[] range = {Integer.MAX_VALUE, -1};
        Token[] rightmost = {tok};
        forEach(tok, t -> {
            range[0] = Math.min(range[0], t.getIndex());
            int end = t.getIndex();
            if (t.isOneOf(TokenType.LPAREN, TokenType.LBRACKET, TokenType.LBRACE) && t.getLink() != null) {
                end = Math.max(end, t.getLink().getIndex());
            }
            if (end > range[1]) {
                range[1] = end;
                rightmost[0] = end == t.getIndex() ? t : t.getLink();
            }
        });
        Token last = rightmost[0];
        while (last.getNext() != null && last.getNext().isOneOf(TokenType.RPAREN, TokenType.RBRACKET)
                && last.getNext().getLink() != null && last.getNext().getLink().getIndex() >= range[0]) {
            last = last.getNext();
        }
        return last.getNext();
    }

    /** 子树最左叶子之前的 token */
    public static Token previousBeforeAstLeftmostLeaf(Token tok) {
        if (tok == null) return null;
        Token[] leftmost = {tok};
        forEach(tok, t -> {
            if (t.getIndex() < leftmost[0].getIndex()) {
                leftmost[0] = t;
            }
        });
        return leftmost[0].getPrevious();
    }

    // ============ 调用 ============

    /** if/while/for 及 do-while 尾部的括号 */
    public static boolean isControlParen(Token tok) {
        return tok != null && tok.is(TokenType.LPAREN) && tok.getAstOperand1() != null
                && tok.getAstOperand1().isOneOf(TokenType.KW_IF, TokenType.KW_WHILE, TokenType.KW_FOR);
    }

    /** 函数调用的 '('，不含类型转换、直接初始化与控制括号 */
    public static boolean isFunctionCall(Token tok) {
        return tok != null && tok.is(TokenType.LPAREN) && !tok.isCast() && !tok.isDirectInit()
                && tok.getAstOperand1() != null && !isControlParen(tok);
    }

    /** 调用括号对应的函数名 token，{@code a.f()}、{@code ns::f()} 取成员名 */
    public static Token getCallName(Token paren) {
        if (!isFunctionCall(paren)) return null;
        Token callee = paren.getAstOperand1();
        if (callee.isOneOf(TokenType.DOT, TokenType.ARROW, TokenType.DOUBLE_COLON)) {
            callee = callee.getAstOperand2();
        }
        return callee != null && callee.is(TokenType.IDENTIFIER) ? callee : null;
    }

    public static List<Token> getArguments(Token paren) {
        if (paren == null || paren.getAstOperand2() == null) return Collections.emptyList();
        return astFlatten(paren.getAstOperand2(), ",");
    }

    public static int numberOfArguments(Token paren) {
        return getArguments(paren).size();
    }

    /** 参数所在的调用括号及其下标，不是调用参数时返回 null */
    public static Token getCallParen(Token arg, int[] indexOut) {
        Token tok = arg;
        Token parent = tok.getAstParent();
        while (parent != null && parent.is(TokenType.COMMA)) {
            tok = parent;
            parent = parent.getAstParent();
        }
        if (!isFunctionCall(parent) || parent.getAstOperand2() != tok) return null;
        if (indexOut != null) {
            indexOut[0] = getArguments(parent).indexOf(arg);
        }
        return parent;
    }

    // ============ 条件 ============

    /** 值是否被当作布尔条件使用 */
    public static boolean isUsedAsBool(Token tok) {
        if (tok == null) return false;
        Token parent = tok.getAstParent();
        if (parent == null) return false;
        if (parent.isOneOf(TokenType.NOT, TokenType.AND, TokenType.OR)) return true;
        if (parent.is(TokenType.QUESTION)) return parent.getAstOperand1() == tok;
        if (isControlParen(parent)) return parent.getAstOperand2() == tok;
        if (parent.is(TokenType.SEMICOLON) && parent.getAstParent() != null
                && parent.getAstParent().is(TokenType.SEMICOLON)) {
            return parent.getAstOperand1() == tok;
        }
        return false;
    }

    /** 控制括号中的条件表达式 */
    public static Token getCondTok(Token paren) {
        if (!isControlParen(paren)) return null;
        if (paren.getAstOperand1().is(TokenType.KW_FOR)) {
            Token semi = paren.getAstOperand2();
            if (semi == null || !semi.is(TokenType.SEMICOLON) || semi.getAstOperand2() == null) return null;
            return semi.getAstOperand2().getAstOperand1();
        }
        return paren.getAstOperand2();
    }

    /**
     * 由块结尾 '}' 找到控制它的条件；{@code } else {} 返回 if 的条件，do 块与普通块返回 null
     */
    public static Token getCondTokFromEnd(Token endBlock) {
        if (endBlock == null || !endBlock.is(TokenType.RBRACE)) return null;
        Token startBlock = endBlock.getLink();
        if (startBlock == null) return null;
        Token before = startBlock.getPrevious();
        if (before == null) return null;
        if (before.is(TokenType.RPAREN)) {
            return getCondTok(before.getLink());
        }
        if (before.is(TokenType.KW_ELSE) && before.getPrevious() != null && before.getPrevious().is(TokenType.RBRACE)) {
            return getCondTokFromEnd(before.getPrevious());
        }
        return null;
    }

    /** 三段式 for 循环的块 */
    public static boolean isBasicForLoop(Token tok) {
        if (tok == null) return false;
        if (tok.is(TokenType.RBRACE)) return isBasicForLoop(tok.getLink());
        Token close = tok.getPrevious();
        if (!tok.is(TokenType.LBRACE) || close == null || !close.is(TokenType.RPAREN)) return false;
        Token start = close.getLink();
        if (start == null || start.getPrevious() == null || !start.getPrevious().is(TokenType.KW_FOR)) return false;
        return start.getAstOperand2() != null && start.getAstOperand2().is(TokenType.SEMICOLON);
    }

    public static boolean astIsUnsigned(Token tok) {
        return tok != null && tok.getValueType() != null && tok.getValueType().isUnsigned();
    }
}
