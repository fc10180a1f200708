package io.codefmt.lex;

import io.codefmt.config.Language;
import io.codefmt.token.Token;
import io.codefmt.token.TokenFlag;
import io.codefmt.token.TokenKind;
import io.codefmt.token.TokenList;
import io.codefmt.token.TokenRole;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Splits C-family source text into a {@link TokenList} and annotates each token with the structure
 * the formatting rules rely on: nesting, brace and preprocessor levels, the owner of condition and
 * call parentheses, statement starts and directive membership.
 *
 * <p>This is a lexical approximation, not a parser. Angle brackets are always read as comparisons
 * and a word followed by {@code (} is a call unless the word before it makes it look like a
 * declaration.
 */
public class SourceTokenizer {

    private static final Logger LOGGER = LoggerFactory.getLogger(SourceTokenizer.class);

    private static final Map<String, TokenKind> KEYWORDS = Map.ofEntries(
            Map.entry("if", TokenKind.IF),
            Map.entry("else", TokenKind.ELSE),
            Map.entry("switch", TokenKind.SWITCH),
            Map.entry("while", TokenKind.WHILE),
            Map.entry("for", TokenKind.FOR),
            Map.entry("do", TokenKind.DO),
            Map.entry("return", TokenKind.RETURN),
            Map.entry("case", TokenKind.CASE),
            Map.entry("default", TokenKind.DEFAULT),
            Map.entry("break", TokenKind.BREAK),
            Map.entry("continue", TokenKind.CONTINUE),
            Map.entry("goto", TokenKind.GOTO));

    private static final Set<String> TYPE_WORDS = Set.of(
            "void", "char", "short", "int", "long", "float", "double", "signed", "unsigned",
            "bool", "_Bool", "boolean", "byte", "const", "volatile", "static", "extern", "register",
            "struct", "union", "enum", "class", "auto", "size_t", "ssize_t", "string", "String",
            "object", "Object", "var", "uint", "ulong", "ushort", "sbyte", "decimal");

    /** Words that take a parenthesised operand without being calls. */
    private static final Set<String> NON_CALL_WORDS = Set.of(
            "sizeof", "typeof", "alignof", "decltype", "catch", "foreach", "synchronized", "using",
            "lock", "fixed", "defined", "__attribute__", "static_assert", "checked", "unchecked");

    /** Words after which {@code name(} is still a call rather than a declaration. */
    private static final Set<String> CALL_CONTEXT_WORDS = Set.of(
            "new", "throw", "delete", "co_return", "co_await", "await", "yield", "typedef", "in", "out", "ref");

    private static final List<String> OPERATORS = List.of(
            ">>=", "<<=", "<=>", "->*", "...",
            "==", "!=", "<=", ">=", "&&", "||", "++", "--", "+=", "-=", "*=", "/=", "%=", "&=", "|=",
            "^=", "<<", ">>", "->", "::", ".*");

    private static final Set<TokenKind> UNARY_CONTEXT = EnumSet.of(
            TokenKind.NONE, TokenKind.ASSIGN, TokenKind.COMPARE, TokenKind.BOOL, TokenKind.ARITH,
            TokenKind.NOT, TokenKind.INV, TokenKind.POS, TokenKind.NEG, TokenKind.QUESTION,
            TokenKind.COND_COLON, TokenKind.COLON, TokenKind.COMMA, TokenKind.SEMICOLON,
            TokenKind.RETURN, TokenKind.CASE, TokenKind.ELSE, TokenKind.DO,
            TokenKind.PAREN_OPEN, TokenKind.SPAREN_OPEN, TokenKind.FPAREN_OPEN,
            TokenKind.BRACE_OPEN, TokenKind.BRACE_CLOSE, TokenKind.SQUARE_OPEN, TokenKind.ANGLE_OPEN);

    private final int tabSize;

    public SourceTokenizer(int tabSize) {
        if (tabSize < 1) {
            throw new IllegalArgumentException("tabSize must be at least 1");
        }
        this.tabSize = tabSize;
    }

    public TokenList tokenize(String source, Language language) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(language, "language");
        TokenList tokens = new Run(source.replace("\r\n", "\n")).tokenize();
        LOGGER.debug("Tokenized {} characters of {} into {} tokens", source.length(), language, tokens.size());
        return tokens;
    }

    /**
     * Cursor and structural state for tokenizing one source text.
     */
    private final class Run {

        private final String src;
        private final TokenList tokens = new TokenList();
        private final LexState code = new LexState();
        private LexState directive;
        private boolean includeDirective;
        private int preprocLevel;
        private int directivePreprocLevel;
        private int preprocLevelAfterDirective;
        private int pos;
        private int line = 1;
        private int col = 1;
        private boolean sawSpace;
        private boolean atLineStart = true;

        private Run(String src) {
            this.src = src;
        }

        private TokenList tokenize() {
            while (pos < src.length()) {
                char c = src.charAt(pos);
                if (c == '\n') {
                    lexNewlines();
                } else if (c == ' ' || c == '\t' || c == '\f' || c == '\r') {
                    advance(c);
                    pos++;
                    sawSpace = true;
                } else if (c == '\\' && onlyBlanksToLineEnd(pos + 1)) {
                    lexContinuation();
                } else if (c == '#' && atLineStart && directive == null) {
                    lexDirectiveStart();
                } else if (c == '/' && peek(1) == '/') {
                    lexLineComment();
                } else if (c == '/' && peek(1) == '*') {
                    lexBlockComment();
                } else if (c == '"' || c == '\'') {
                    lexQuoted(c);
                } else if (c == '@' && peek(1) == '"') {
                    lexVerbatimString();
                } else if (Character.isDigit(c) || (c == '.' && Character.isDigit(peek(1)))) {
                    lexNumber();
                } else if (Character.isJavaIdentifierStart(c)) {
                    lexWord();
                } else if (c == '<' && includeDirective) {
                    lexIncludePath();
                } else {
                    lexOperator();
                }
            }
            endDirective();
            return tokens;
        }

        private void lexNewlines() {
            endDirective();
            int startLine = line;
            int startCol = col;
            int count = 0;
            int afterLastNewline = pos;
            int cursor = pos;
            while (cursor < src.length()) {
                char c = src.charAt(cursor);
                if (c == '\n') {
                    count++;
                    cursor++;
                    afterLastNewline = cursor;
                } else if (c == ' ' || c == '\t' || c == '\f' || c == '\r') {
                    cursor++;
                } else {
                    break;
                }
            }
            Token newline = newToken(TokenKind.NEWLINE, "\n", startLine, startCol, startCol + 1);
            newline.setNewlineCount(count);
            tokens.append(newline);
            pos = afterLastNewline;
            line += count;
            col = 1;
            sawSpace = false;
            atLineStart = true;
        }

        private void lexContinuation() {
            int startLine = line;
            int startCol = col;
            int cursor = pos + 1;
            while (cursor < src.length() && src.charAt(cursor) != '\n') {
                cursor++;
            }
            Token continuation = newToken(TokenKind.NL_CONT, "\\", startLine, startCol, startCol + 1);
            continuation.setNewlineCount(1);
            tokens.append(continuation);
            pos = Math.min(cursor + 1, src.length());
            line++;
            col = 1;
            sawSpace = false;
            atLineStart = false;
        }

        private void lexDirectiveStart() {
            int cursor = pos + 1;
            while (cursor < src.length() && (src.charAt(cursor) == ' ' || src.charAt(cursor) == '\t')) {
                cursor++;
            }
            int wordStart = cursor;
            while (cursor < src.length() && Character.isJavaIdentifierPart(src.charAt(cursor))) {
                cursor++;
            }
            String word = src.substring(wordStart, cursor);

            directive = new LexState();
            directive.expectStatementStart = false;
            includeDirective = word.equals("include") || word.equals("import") || word.equals("include_next");
            preprocLevelAfterDirective = preprocLevel;
            if (word.startsWith("if")) {
                directivePreprocLevel = preprocLevel;
                preprocLevelAfterDirective = preprocLevel + 1;
            } else if (word.equals("else") || word.startsWith("elif")) {
                directivePreprocLevel = Math.max(0, preprocLevel - 1);
            } else if (word.equals("endif")) {
                preprocLevel = Math.max(0, preprocLevel - 1);
                directivePreprocLevel = preprocLevel;
                preprocLevelAfterDirective = preprocLevel;
            } else {
                directivePreprocLevel = preprocLevel;
            }
            emit(TokenKind.PREPROC, cursor - pos);
        }

        private void endDirective() {
            if (directive == null) {
                return;
            }
            directive = null;
            includeDirective = false;
            preprocLevel = preprocLevelAfterDirective;
        }

        private void lexLineComment() {
            int cursor = pos;
            while (cursor < src.length() && src.charAt(cursor) != '\n') {
                cursor++;
            }
            emit(TokenKind.COMMENT, cursor - pos);
        }

        private void lexBlockComment() {
            int end = src.indexOf("*/", pos + 2);
            int cursor = end < 0 ? src.length() : end + 2;
            emit(TokenKind.COMMENT, cursor - pos);
        }

        private void lexQuoted(char quote) {
            int cursor = pos + 1;
            while (cursor < src.length()) {
                char c = src.charAt(cursor);
                if (c == '\\' && cursor + 1 < src.length() && src.charAt(cursor + 1) != '\n') {
                    cursor += 2;
                } else if (c == quote) {
                    cursor++;
                    break;
                } else if (c == '\n') {
                    break;
                } else {
                    cursor++;
                }
            }
            emit(TokenKind.STRING, cursor - pos);
        }

        private void lexVerbatimString() {
            int cursor = pos + 2;
            while (cursor < src.length()) {
                if (src.charAt(cursor) == '"') {
                    if (cursor + 1 < src.length() && src.charAt(cursor + 1) == '"') {
                        cursor += 2;
                        continue;
                    }
                    cursor++;
                    break;
                }
                cursor++;
            }
            emit(TokenKind.STRING, cursor - pos);
        }

        private void lexIncludePath() {
            int cursor = pos + 1;
            while (cursor < src.length() && src.charAt(cursor) != '>' && src.charAt(cursor) != '\n') {
                cursor++;
            }
            if (cursor < src.length() && src.charAt(cursor) == '>') {
                cursor++;
            }
            emit(TokenKind.STRING, cursor - pos);
        }

        private void lexNumber() {
            boolean hex = src.startsWith("0x", pos) || src.startsWith("0X", pos);
            int cursor = pos;
            while (cursor < src.length()) {
                char c = src.charAt(cursor);
                if (Character.isLetterOrDigit(c) || c == '_' || c == '.' || c == '\'') {
                    cursor++;
                } else if ((c == '+' || c == '-') && cursor > pos && isExponentMarker(src.charAt(cursor - 1), hex)) {
                    cursor++;
                } else {
                    break;
                }
            }
            String text = src.substring(pos, cursor);
            boolean floating = text.indexOf('.') >= 0
                    || (!hex && (text.indexOf('e') >= 0 || text.indexOf('E') >= 0))
                    || (hex && (text.indexOf('p') >= 0 || text.indexOf('P') >= 0));
            emit(floating ? TokenKind.NUMBER_FP : TokenKind.NUMBER, cursor - pos);
        }

        private boolean isExponentMarker(char c, boolean hex) {
            return hex ? c == 'p' || c == 'P' : c == 'e' || c == 'E';
        }

        private void lexWord() {
            int cursor = pos;
            while (cursor < src.length() && Character.isJavaIdentifierPart(src.charAt(cursor))) {
                cursor++;
            }
            String word = src.substring(pos, cursor);
            TokenKind kind = KEYWORDS.get(word);
            LexState state = state();
            if (kind == null) {
                if (TYPE_WORDS.contains(word) || nextNonBlankStartsWith(cursor, "::")) {
                    kind = TokenKind.TYPE;
                } else if (nextNonBlankStartsWith(cursor, "(") && !NON_CALL_WORDS.contains(word)) {
                    kind = looksLikeDeclaration(state.previous) ? TokenKind.FUNC_DEF : TokenKind.FUNC_CALL;
                } else {
                    kind = TokenKind.WORD;
                }
            }
            TokenRole conditionRole = switch (kind) {
                case IF -> state.previous.is(TokenKind.ELSE) ? TokenRole.ELSEIF : TokenRole.IF;
                case WHILE -> TokenRole.WHILE;
                case SWITCH -> TokenRole.SWITCH;
                case FOR -> TokenRole.FOR;
                default -> TokenRole.NONE;
            };
            emit(kind, cursor - pos);
            state.pendingConditionRole = conditionRole;
            if (kind == TokenKind.ELSE || kind == TokenKind.DO) {
                state.expectStatementStart = true;
            }
        }

        private boolean looksLikeDeclaration(Token previous) {
            if (previous.is(TokenKind.TYPE)) {
                return true;
            }
            return previous.is(TokenKind.WORD) && !CALL_CONTEXT_WORDS.contains(previous.text());
        }

        private void lexOperator() {
            String text = String.valueOf(src.charAt(pos));
            for (String candidate : OPERATORS) {
                if (src.startsWith(candidate, pos)) {
                    text = candidate;
                    break;
                }
            }
            LexState state = state();
            switch (text) {
                case "(" -> openParen(state);
                case "[" -> openBracket(state, TokenKind.SQUARE_OPEN, TokenKind.SQUARE_CLOSE);
                case "{" -> {
                    openBracket(state, TokenKind.BRACE_OPEN, TokenKind.BRACE_CLOSE);
                    state.expectStatementStart = true;
                }
                case ")" -> closeBracket(state, ')', TokenKind.PAREN_CLOSE);
                case "]" -> closeBracket(state, ']', TokenKind.SQUARE_CLOSE);
                case "}" -> {
                    closeBracket(state, '}', TokenKind.BRACE_CLOSE);
                    state.expectStatementStart = true;
                }
                case ";" -> {
                    emit(TokenKind.SEMICOLON, 1);
                    state.openQuestions = 0;
                    if (!state.insideParens()) {
                        state.expectStatementStart = true;
                    }
                }
                case "?" -> {
                    emit(TokenKind.QUESTION, 1);
                    state.openQuestions++;
                }
                case ":" -> {
                    if (state.openQuestions > 0) {
                        state.openQuestions--;
                        emit(TokenKind.COND_COLON, 1);
                    } else {
                        emit(TokenKind.COLON, 1);
                        if (!state.insideParens()) {
                            state.expectStatementStart = true;
                        }
                    }
                }
                default -> emit(operatorKind(text, state.previous), text.length());
            }
        }

        private TokenKind operatorKind(String text, Token previous) {
            return switch (text) {
                case "==", "!=", "<", ">", "<=", ">=", "<=>" -> TokenKind.COMPARE;
                case "&&", "||" -> TokenKind.BOOL;
                case "=", "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", "<<=", ">>=" -> TokenKind.ASSIGN;
                case "!" -> TokenKind.NOT;
                case "~" -> TokenKind.INV;
                case "++", "--" -> TokenKind.INCDEC;
                case "+" -> UNARY_CONTEXT.contains(previous.kind()) ? TokenKind.POS : TokenKind.ARITH;
                case "-" -> UNARY_CONTEXT.contains(previous.kind()) ? TokenKind.NEG : TokenKind.ARITH;
                case ".", "->", "->*", ".*" -> TokenKind.MEMBER;
                case "::" -> TokenKind.DC_MEMBER;
                case "," -> TokenKind.COMMA;
                case "*", "/", "%", "&", "|", "^", "<<", ">>", "..." -> TokenKind.ARITH;
                default -> TokenKind.WORD;
            };
        }

        private void openParen(LexState state) {
            TokenKind kind;
            TokenRole role;
            if (state.pendingConditionRole != TokenRole.NONE) {
                kind = TokenKind.SPAREN_OPEN;
                role = state.pendingConditionRole;
            } else if (state.previous.is(TokenKind.FUNC_CALL)) {
                kind = TokenKind.FPAREN_OPEN;
                role = TokenRole.FUNC_CALL;
            } else if (state.previous.is(TokenKind.FUNC_DEF)) {
                kind = TokenKind.FPAREN_OPEN;
                role = TokenRole.FUNC_DEF;
            } else {
                kind = TokenKind.PAREN_OPEN;
                role = TokenRole.NONE;
            }
            Token open = emit(kind, 1);
            open.setRole(role);
            state.push(new LexState.Frame(kind.closer(), role));
        }

        private void openBracket(LexState state, TokenKind kind, TokenKind closeKind) {
            emit(kind, 1);
            state.push(new LexState.Frame(closeKind, TokenRole.NONE));
        }

        private void closeBracket(LexState state, char closer, TokenKind fallback) {
            LexState.Frame frame = state.pop(closer);
            if (frame == null) {
                LOGGER.debug("Unmatched '{}' at {}:{}", closer, line, col);
                emit(fallback, 1);
                return;
            }
            Token close = emit(frame.closeKind(), 1);
            close.setRole(frame.role());
            if (frame.closeKind() == TokenKind.SPAREN_CLOSE) {
                state.expectStatementStart = true;
            }
        }

        private Token emit(TokenKind kind, int length) {
            int startLine = line;
            int startCol = col;
            String text = src.substring(pos, pos + length);
            for (int i = 0; i < length; i++) {
                advance(src.charAt(pos + i));
            }
            pos += length;
            Token token = newToken(kind, text, startLine, startCol, col);
            if (sawSpace) {
                token.addFlag(TokenFlag.PRECEDED_BY_SPACE);
            }
            LexState state = state();
            if (kind != TokenKind.COMMENT) {
                if (state.expectStatementStart) {
                    token.addFlag(TokenFlag.STATEMENT_START);
                    state.expectStatementStart = false;
                }
                state.previous = token;
                state.pendingConditionRole = TokenRole.NONE;
            }
            tokens.append(token);
            sawSpace = false;
            atLineStart = false;
            return token;
        }

        private Token newToken(TokenKind kind, String text, int startLine, int startCol, int endCol) {
            Token token = new Token(kind, text);
            token.setOrigin(startLine, startCol, endCol);
            token.setRenderColumn(startCol);
            int nesting = code.depth();
            int brace = code.braceDepth;
            int preproc = preprocLevel;
            if (directive != null && kind != TokenKind.NEWLINE) {
                nesting += directive.depth();
                brace += directive.braceDepth;
                preproc = directivePreprocLevel;
                token.addFlag(TokenFlag.IN_PREPROC);
            }
            token.setLevels(nesting, brace, preproc);
            return token;
        }

        private LexState state() {
            return directive != null ? directive : code;
        }

        private void advance(char c) {
            if (c == '\t') {
                col = ((col - 1) / tabSize + 1) * tabSize + 1;
            } else if (c == '\n') {
                line++;
                col = 1;
            } else {
                col++;
            }
        }

        private char peek(int offset) {
            int index = pos + offset;
            return index < src.length() ? src.charAt(index) : '\0';
        }

        private boolean onlyBlanksToLineEnd(int from) {
            for (int i = from; i < src.length(); i++) {
                char c = src.charAt(i);
                if (c == '\n') {
                    return true;
                }
                if (c != ' ' && c != '\t' && c != '\r') {
                    return false;
                }
            }
            return false;
        }

        private boolean nextNonBlankStartsWith(int from, String expected) {
            int cursor = from;
            while (cursor < src.length() && (src.charAt(cursor) == ' ' || src.charAt(cursor) == '\t')) {
                cursor++;
            }
            return src.startsWith(expected, cursor);
        }
    }
}
