package br.ufscar.dc.runml;

import org.antlr.v4.runtime.Token;

/**
 * Traduz expressoes aritmeticas ml para C.
 *
 * Nao monta arvore: '*' e '/' sao quebrados da esquerda para a direita pela
 * primeira ocorrencia, enquanto '+' e '-' passam adiante como texto.
 */
public class MlExpressao {

    private final MlLog log;

    public MlExpressao(MlLog log) {
        this.log = log;
    }

    public String translate(String expr) {
        validate(expr);
        StringBuilder output = new StringBuilder();
        translateTerm(expr, output);
        return output.toString();
    }

    /** Uma passada so: caracteres permitidos e parenteses balanceados. */
    void validate(String expr) {
        int openParens = 0;
        for (Token t : MlUtils.tokenize(expr)) {
            switch (t.getType()) {
                case MlLexer.ABRE_PAR:
                    openParens++;
                    break;
                case MlLexer.FECHA_PAR:
                    openParens--;
                    if (openParens < 0) {
                        throw MlException.syntax("Unmatched closing parenthesis in expression: %s", expr);
                    }
                    break;
                case MlLexer.ERRO:
                    throw MlException.syntax("Invalid character in expression: %s", t.getText());
                default:
                    break;
            }
        }
        if (openParens != 0) {
            throw MlException.syntax("Unmatched opening parenthesis in expression: %s", expr);
        }
    }

    private void translateTerm(String expr, StringBuilder output) {
        int op = firstMultiplicativeOperator(expr);
        if (op < 0) {
            log.code("Factor - %s", expr);
            output.append(expr);
            return;
        }
        String left = expr.substring(0, op);
        char operator = expr.charAt(op);
        String right = expr.substring(op + 1);
        log.code("Term - Left term: %s, Operator: %c, Right term: %s", left, operator, right);
        translateTerm(left, output);
        output.append(' ').append(operator).append(' ');
        translateTerm(right, output);
    }

    private static int firstMultiplicativeOperator(String expr) {
        for (int i = 0; i < expr.length(); i++) {
            char c = expr.charAt(i);
            if (c == '*' || c == '/') {
                return i;
            }
        }
        return -1;
    }
}
