/* This code is part of TuskLang. It is distributed under the GNU General
 * Public License, version 2 (or at your option any later version). See
 * http://www.gnu.org/ for further details of the GPL. */
package tusklang.fujsen;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Finds the names a FUJSEN body reads from its surroundings.
 *
 * <p>This is a lexical approximation, not a parser. Identifiers are collected outside string
 * and template literals (but inside {@code ${...}} substitutions) and outside comments. An
 * identifier is not free when it is</p>
 * <ul>
 *   <li>a reserved word or a well-known global,</li>
 *   <li>a property name after {@code .} or {@code ?.}, or a key in an object literal,</li>
 *   <li>declared anywhere in the body: by {@code let}, {@code const} or {@code var}, as a
 *   function or class name, as a function or arrow parameter, or as a {@code catch}
 *   parameter.</li>
 * </ul>
 * <p>Scopes are not modelled: a name declared anywhere is treated as declared everywhere.
 * A single leading {@code $} is dropped so PHP-style bodies report {@code $price} as
 * {@code price}. Regular expression literals are not recognized.</p>
 *
 * <p>Instances are immutable and thread-safe.</p>
 */
public final class FreeVariableScanner {

    static final Set<String> RESERVED = Set.of(
        "break", "case", "catch", "class", "const", "continue", "debugger", "default", "delete",
        "do", "else", "export", "extends", "finally", "for", "function", "if", "import", "in",
        "instanceof", "let", "new", "return", "super", "switch", "this", "throw", "try",
        "typeof", "var", "void", "while", "with", "yield", "async", "await", "of", "true",
        "false", "null", "undefined", "NaN", "Infinity", "arguments", "fn", "echo", "isset",
        "empty", "array");

    static final Set<String> GLOBALS = Set.of(
        "Math", "JSON", "Date", "Object", "Array", "String", "Number", "Boolean", "Promise",
        "RegExp", "Error", "TypeError", "RangeError", "Map", "Set", "WeakMap", "WeakSet",
        "Symbol", "BigInt", "Intl", "parseInt", "parseFloat", "isNaN", "isFinite", "console",
        "globalThis", "encodeURIComponent", "decodeURIComponent", "encodeURI", "decodeURI",
        "setTimeout", "clearTimeout", "require", "module", "exports", "process", "Buffer");

    public static final FreeVariableScanner DEFAULT = new FreeVariableScanner(Set.of());

    private final Set<String> ignored;

    /**
     * @param hostGlobals additional names the host runtime predefines
     */
    public FreeVariableScanner(Set<String> hostGlobals) {
        Set<String> all = new HashSet<>(RESERVED);
        all.addAll(GLOBALS);
        all.addAll(hostGlobals);
        this.ignored = Set.copyOf(all);
    }

    public List<String> scan(String body) {
        List<Tok> toks = tokenize(body);
        Set<String> declared = collectDeclarations(toks);

        Set<String> free = new LinkedHashSet<>();
        for (int i = 0; i < toks.size(); i++) {
            Tok t = toks.get(i);
            if (!t.isIdent() || ignored.contains(t.name()) || declared.contains(t.name())) {
                continue;
            }
            Tok prev = i > 0 ? toks.get(i - 1) : null;
            Tok next = i + 1 < toks.size() ? toks.get(i + 1) : null;
            if (prev != null && (prev.is(".") || prev.is("?."))) {
                continue;
            }
            if (next != null && next.is(":") && prev != null && (prev.is("{") || prev.is(","))
                && isObjectKeyPosition(toks, i)) {
                continue;
            }
            free.add(t.name());
        }
        return List.copyOf(free);
    }

    // -- declarations

    private static Set<String> collectDeclarations(List<Tok> toks) {
        Set<String> declared = new HashSet<>();
        for (int i = 0; i < toks.size(); i++) {
            Tok t = toks.get(i);
            if (!t.isIdent() && !t.is("=>")) {
                continue;
            }
            switch (t.text) {
                case "let", "const", "var" -> declareBindingList(toks, i + 1, declared);
                case "function" -> {
                    int j = i + 1;
                    if (j < toks.size() && toks.get(j).is("*")) {
                        j++;
                    }
                    if (j < toks.size() && toks.get(j).isIdent()) {
                        declared.add(toks.get(j).name());
                        j++;
                    }
                    if (j < toks.size() && toks.get(j).is("(")) {
                        declareParameters(toks, j, declared);
                    }
                }
                case "class" -> {
                    if (i + 1 < toks.size() && toks.get(i + 1).isIdent()) {
                        declared.add(toks.get(i + 1).name());
                    }
                }
                case "catch" -> {
                    if (i + 1 < toks.size() && toks.get(i + 1).is("(")) {
                        declareParameters(toks, i + 1, declared);
                    }
                }
                case "=>" -> {
                    Tok prev = i > 0 ? toks.get(i - 1) : null;
                    if (prev != null && prev.isIdent()) {
                        declared.add(prev.name());
                    } else if (prev != null && prev.is(")")) {
                        int open = matchingOpen(toks, i - 1);
                        if (open >= 0) {
                            declareParameters(toks, open, declared);
                        }
                    }
                }
                default -> {
                }
            }
        }
        return declared;
    }

    /**
     * Declares the names bound by {@code let a = 1, {b, c} = o}: identifiers at the start of
     * each declarator, including everything inside a destructuring pattern. Stops at the end
     * of the statement.
     */
    private static void declareBindingList(List<Tok> toks, int from, Set<String> declared) {
        boolean atDeclarator = true;
        int depth = 0;
        for (int j = from; j < toks.size(); j++) {
            Tok t = toks.get(j);
            if (depth == 0 && atDeclarator) {
                if (t.isIdent()) {
                    declared.add(t.name());
                    atDeclarator = false;
                    continue;
                }
                if (t.is("{") || t.is("[")) {
                    int close = matchingClose(toks, j);
                    declarePattern(toks, j + 1, close, declared);
                    j = close;
                    atDeclarator = false;
                    continue;
                }
                return;
            }
            if (t.is("(") || t.is("[") || t.is("{")) {
                depth++;
            } else if (t.is(")") || t.is("]") || t.is("}")) {
                if (depth == 0) {
                    return;
                }
                depth--;
            } else if (depth == 0 && t.is(",")) {
                atDeclarator = true;
            } else if (depth == 0 && (t.is(";") || t.is("of") || t.is("in"))) {
                return;
            } else if (depth == 0 && t.newlineBefore && !toks.get(j - 1).isOperator()) {
                return;
            }
        }
    }

    /**
     * Declares parameters in the list opened at {@code open}. Default value expressions are
     * skipped, so names they read stay free.
     */
    private static void declareParameters(List<Tok> toks, int open, Set<String> declared) {
        int close = matchingClose(toks, open);
        boolean inDefault = false;
        int depth = 0;
        for (int j = open + 1; j < close; j++) {
            Tok t = toks.get(j);
            if (depth == 0 && t.is(",")) {
                inDefault = false;
            } else if (depth == 0 && t.is("=")) {
                inDefault = true;
            } else if (!inDefault && (t.is("{") || t.is("["))) {
                int end = matchingClose(toks, j);
                declarePattern(toks, j + 1, end, declared);
                j = end;
            } else if (t.is("(") || t.is("[") || t.is("{")) {
                depth++;
            } else if (t.is(")") || t.is("]") || t.is("}")) {
                depth--;
            } else if (!inDefault && depth == 0 && t.isIdent()) {
                declared.add(t.name());
            }
        }
    }

    private static void declarePattern(List<Tok> toks, int from, int to, Set<String> declared) {
        for (int j = from; j < to && j < toks.size(); j++) {
            Tok t = toks.get(j);
            if (t.isIdent() && !(j + 1 < to && toks.get(j + 1).is(":"))) {
                declared.add(t.name());
            }
        }
    }

    /**
     * An identifier followed by {@code :} after {@code {} or {@code ,} is an object key unless
     * it sits in a {@code case} label or the middle of a conditional expression.
     */
    private static boolean isObjectKeyPosition(List<Tok> toks, int index) {
        int depth = 0;
        for (int j = index - 1; j >= 0; j--) {
            Tok t = toks.get(j);
            if (t.is(")") || t.is("]") || t.is("}")) {
                depth++;
            } else if (t.is("(") || t.is("[")) {
                if (depth == 0) {
                    return false;
                }
                depth--;
            } else if (t.is("{")) {
                if (depth == 0) {
                    return true;
                }
                depth--;
            } else if (depth == 0 && (t.is("?") || t.is("case"))) {
                return false;
            }
        }
        return false;
    }

    private static int matchingClose(List<Tok> toks, int open) {
        int depth = 0;
        for (int j = open; j < toks.size(); j++) {
            Tok t = toks.get(j);
            if (t.is("(") || t.is("[") || t.is("{")) {
                depth++;
            } else if (t.is(")") || t.is("]") || t.is("}")) {
                depth--;
                if (depth == 0) {
                    return j;
                }
            }
        }
        return toks.size();
    }

    private static int matchingOpen(List<Tok> toks, int close) {
        int depth = 0;
        for (int j = close; j >= 0; j--) {
            Tok t = toks.get(j);
            if (t.is(")") || t.is("]") || t.is("}")) {
                depth++;
            } else if (t.is("(") || t.is("[") || t.is("{")) {
                depth--;
                if (depth == 0) {
                    return j;
                }
            }
        }
        return -1;
    }

    // -- tokens

    private static List<Tok> tokenize(String s) {
        List<Tok> toks = new ArrayList<>();
        // brace depth at which each open template substitution resumes the template
        Deque<Integer> templates = new ArrayDeque<>();
        int braces = 0;
        boolean newline = false;
        int i = 0;
        int n = s.length();
        while (i < n) {
            char c = s.charAt(i);
            if (c == '\n' || c == '\r') {
                newline = true;
                i++;
            } else if (Character.isWhitespace(c)) {
                i++;
            } else if (c == '/' && i + 1 < n && s.charAt(i + 1) == '/') {
                while (i < n && s.charAt(i) != '\n') {
                    i++;
                }
            } else if (c == '/' && i + 1 < n && s.charAt(i + 1) == '*') {
                int end = s.indexOf("*/", i + 2);
                i = end < 0 ? n : end + 2;
            } else if (c == '"' || c == '\'') {
                i = skipString(s, i);
                toks.add(new Tok("\"\"", newline));
                newline = false;
            } else if (c == '`') {
                i = skipTemplate(s, i + 1, templates, braces);
                toks.add(new Tok("\"\"", newline));
                newline = false;
            } else if (c == '}' && !templates.isEmpty() && templates.peek() == braces) {
                templates.pop();
                i = skipTemplate(s, i + 1, templates, braces);
            } else if (isIdentStart(c)) {
                int start = i;
                while (i < n && isIdentPart(s.charAt(i))) {
                    i++;
                }
                toks.add(new Tok(s.substring(start, i), newline));
                newline = false;
            } else if (Character.isDigit(c)) {
                while (i < n && (isIdentPart(s.charAt(i)) || s.charAt(i) == '.')) {
                    i++;
                }
                toks.add(new Tok("0", newline));
                newline = false;
            } else {
                String op = operatorAt(s, i);
                if (op.equals("{")) {
                    braces++;
                } else if (op.equals("}")) {
                    braces--;
                }
                toks.add(new Tok(op, newline));
                newline = false;
                i += op.length();
            }
        }
        return toks;
    }

    /**
     * Skips template text up to the closing backtick, or up to a {@code ${} whose
     * substitution is then tokenized as code.
     */
    private static int skipTemplate(String s, int i, Deque<Integer> templates, int braces) {
        int n = s.length();
        while (i < n) {
            char c = s.charAt(i);
            if (c == '\\') {
                i += 2;
            } else if (c == '`') {
                return i + 1;
            } else if (c == '$' && i + 1 < n && s.charAt(i + 1) == '{') {
                templates.push(braces);
                return i + 2;
            } else {
                i++;
            }
        }
        return n;
    }

    private static int skipString(String s, int i) {
        char quote = s.charAt(i);
        int n = s.length();
        i++;
        while (i < n) {
            char c = s.charAt(i);
            if (c == '\\') {
                i += 2;
            } else if (c == quote || c == '\n') {
                return i + 1;
            } else {
                i++;
            }
        }
        return n;
    }

    private static String operatorAt(String s, int i) {
        for (String op : new String[] {"...", "=>", "?.", "==", "!=", "<=", ">=", "&&", "||",
                                       "??", "++", "--", "+=", "-=", "*=", "/="}) {
            if (s.startsWith(op, i) && !(op.equals("?.") && i + 2 < s.length()
                                         && Character.isDigit(s.charAt(i + 2)))) {
                return op;
            }
        }
        return String.valueOf(s.charAt(i));
    }

    private static boolean isIdentStart(char c) {
        return Character.isLetter(c) || c == '_' || c == '$';
    }

    private static boolean isIdentPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$';
    }

    private record Tok(String text, boolean newlineBefore) {
        boolean is(String s) {
            return text.equals(s);
        }

        boolean isIdent() {
            return isIdentStart(text.charAt(0));
        }

        boolean isOperator() {
            return !isIdent() && !text.equals("\"\"") && !text.equals("0") && !text.equals(")")
                   && !text.equals("]") && !text.equals("}");
        }

        /**
         * The identifier without a PHP-style {@code $} prefix.
         */
        String name() {
            return text.length() > 1 && text.charAt(0) == '$' ? text.substring(1) : text;
        }
    }
}
