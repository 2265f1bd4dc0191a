package br.ufscar.dc.runml;

import java.util.ArrayList;
import java.util.List;

/**
 * Delimita o corpo de uma funcao: a sequencia maxima de linhas com exatamente
 * um tab na frente. Uma linha vazia ou sem tab encerra o corpo quando as duas
 * linhas seguintes tambem nao tem tab; o cabecalho de outra funcao sempre
 * encerra.
 */
public class MlCorpoFuncao {

    private MlCorpoFuncao() {
    }

    /**
     * Consome as linhas do corpo e devolve cada uma sem o tab inicial. A linha
     * que encerra o corpo fica no cursor.
     */
    public static List<String> read(LineCursor cursor, String functionName) {
        List<String> body = new ArrayList<>();
        while (cursor.hasNext()) {
            String line = cursor.peek(0);

            if (MlUtils.isTabIndented(line)) {
                if (line.startsWith("\t\t") || line.startsWith("\t ")) {
                    throw invalidIndentation(functionName);
                }
                cursor.next();
                body.add(line.substring(1));
                continue;
            }

            if (!MlUtils.isBlank(line) && line.startsWith(" ")) {
                throw invalidIndentation(functionName);
            }
            if (MlUtils.isFunctionHeader(line)) {
                break;
            }

            // linha vazia ou sem tab: olha as duas seguintes
            String next1 = cursor.peek(1);
            String next2 = cursor.peek(2);
            if (MlUtils.isTabIndented(next1)) {
                throw invalidIndentation(functionName);
            }
            if (MlUtils.isTabIndented(next2) && !(next1 != null && MlUtils.isFunctionHeader(next1))) {
                throw invalidIndentation(functionName);
            }
            break;
        }
        return body;
    }

    private static MlException invalidIndentation(String functionName) {
        return MlException.syntax("Invalid indentation in function '%s'. Line has spaces or multiple tabs.", functionName);
    }
}
