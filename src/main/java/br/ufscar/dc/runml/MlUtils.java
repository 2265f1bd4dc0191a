package br.ufscar.dc.runml;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.Token;

import br.ufscar.dc.runml.SymbolTable.MlType;

public class MlUtils {
    public static final int MAX_IDENTIFIER_LENGTH = 12;

    public static final String FUNCTION_KEYWORD = "function";
    public static final String PRINT_KEYWORD = "print";
    public static final String RETURN_KEYWORD = "return";
    public static final String ASSIGNMENT = "<-";
    public static final String COMMENT = "#";

    private static final Pattern PROGRAM_ARGUMENT = Pattern.compile("arg(0|[1-9][0-9]{0,5})");

    private MlUtils() {
    }

    // Verifica se os parenteses da linha fecham na ordem certa.
    public static boolean checkParenthesesBalance(String line) {
        int openParens = 0;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == '(') openParens++;
            if (c == ')') openParens--;
            if (openParens < 0) return false; // parentese de fechamento sobrando
        }
        return openParens == 0;
    }

    // Letra inicial, depois letras, digitos ou '_', no maximo 12 caracteres.
    public static boolean isValidIdentifier(String name) {
        if (name == null || name.isEmpty() || name.length() > MAX_IDENTIFIER_LENGTH) {
            return false;
        }
        if (!isAsciiLetter(name.charAt(0))) {
            return false;
        }
        for (int i = 1; i < name.length(); i++) {
            char c = name.charAt(i);
            if (!isAsciiLetter(c) && !isAsciiDigit(c) && c != '_') {
                return false;
            }
        }
        return true;
    }

    // Inferencia puramente lexica: qualquer '.' no texto torna o valor real.
    public static MlType inferType(String value) {
        return value.indexOf('.') >= 0 ? MlType.REAL : MlType.INTEGER;
    }

    public static boolean checkTypeConsistency(MlType varType, String value) {
        return varType == inferType(value);
    }

    public static boolean isBlank(String line) {
        return line.trim().isEmpty();
    }

    public static boolean isComment(String line) {
        return line.startsWith(COMMENT);
    }

    public static boolean isFunctionHeader(String line) {
        return startsWithKeyword(line, FUNCTION_KEYWORD);
    }

    public static boolean isAssignment(String line) {
        return line.contains(ASSIGNMENT);
    }

    public static boolean isPrint(String line) {
        return line.startsWith(PRINT_KEYWORD + " ");
    }

    public static boolean isReturn(String line) {
        return line.startsWith(RETURN_KEYWORD + " ");
    }

    public static boolean isCall(String line) {
        return line.indexOf('(') >= 0 && line.indexOf(')') >= 0;
    }

    public static boolean isTabIndented(String line) {
        return line != null && line.startsWith("\t");
    }

    // Palavra-chave seguida de espaco, tab ou fim de linha.
    private static boolean startsWithKeyword(String line, String keyword) {
        if (!line.startsWith(keyword)) {
            return false;
        }
        return line.length() == keyword.length() || Character.isWhitespace(line.charAt(keyword.length()));
    }

    /** Quebra a lista de argumentos de uma chamada nas virgulas de nivel zero. */
    public static List<String> splitArguments(String arguments) {
        List<String> result = new ArrayList<>();
        if (isBlank(arguments)) {
            return result;
        }
        int depth = 0;
        StringBuilder current = new StringBuilder();
        for (int i = 0; i < arguments.length(); i++) {
            char c = arguments.charAt(i);
            if (c == '(') depth++;
            if (c == ')') depth--;
            if (c == ',' && depth == 0) {
                result.add(current.toString().trim());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        result.add(current.toString().trim());
        return result;
    }

    public static List<Token> tokenize(String text) {
        MlLexer lex = new MlLexer(CharStreams.fromString(text));
        List<Token> tokens = new ArrayList<>();
        for (Token t : lex.getAllTokens()) {
            tokens.add(t);
        }
        return tokens;
    }

    /** Indice N de cada palavra argN da linha, na ordem em que aparecem. */
    public static List<Integer> findProgramArguments(String line) {
        List<Integer> indices = new ArrayList<>();
        for (Token t : tokenize(line)) {
            if (t.getType() != MlLexer.PALAVRA) {
                continue;
            }
            Matcher m = PROGRAM_ARGUMENT.matcher(t.getText());
            if (m.matches()) {
                indices.add(Integer.parseInt(m.group(1)));
            }
        }
        return indices;
    }

    public static String programArgumentName(int index) {
        return "arg" + index;
    }

    private static boolean isAsciiLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private static boolean isAsciiDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
