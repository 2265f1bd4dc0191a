package br.ufscar.dc.runml;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import br.ufscar.dc.runml.SymbolTable.FunctionEntry;

/**
 * Primeira passada: registra funcoes (com o corpo ja traduzido) e variaveis
 * globais antes de qualquer codigo ser emitido.
 */
public class MlSemantico {

    private static final Pattern FUNCTION_HEADER = Pattern.compile("^function\\s+([^\\s(]+)\\s*(.*)$");

    private final SymbolTable symbolTable;
    private final MlComando comando;
    private final MlLog log;

    public MlSemantico(SymbolTable symbolTable, MlLog log) {
        this.symbolTable = symbolTable;
        this.comando = new MlComando(symbolTable, log);
        this.log = log;
    }

    public SymbolTable getSymbolTable() {
        return symbolTable;
    }

    public void collect(LineCursor cursor) {
        log.info("Starting first pass to parse global variables and functions");
        while (cursor.hasNext()) {
            String line = cursor.next();
            if (MlUtils.isBlank(line) || MlUtils.isComment(line)) {
                continue;
            }
            checkLine(line);

            if (MlUtils.isFunctionHeader(line)) {
                storeFunctionDefinitionAndBody(line, cursor);
            } else if (MlUtils.isAssignment(line)) {
                comando.storeVariable(line, true);
            } else if (MlUtils.isCall(line) && !MlUtils.isPrint(line) && !MlUtils.isReturn(line)) {
                // chamadas do main ja definem a assinatura antes dos prototipos
                comando.determineParameterTypes(line.trim());
            }
        }
    }

    private void checkLine(String line) {
        if (!MlUtils.checkParenthesesBalance(line)) {
            throw MlException.syntax("Unbalanced parentheses in line: %s", line);
        }
        for (Integer index : MlUtils.findProgramArguments(line)) {
            symbolTable.addProgramArgument(index, MlUtils.programArgumentName(index));
        }
    }

    private void storeFunctionDefinitionAndBody(String line, LineCursor cursor) {
        Matcher m = FUNCTION_HEADER.matcher(line.trim());
        if (!m.matches()) {
            throw MlException.syntax("Invalid function definition: %s", line);
        }
        String functionName = m.group(1);
        String rest = m.group(2).trim();
        if (!MlUtils.isValidIdentifier(functionName)) {
            throw MlException.syntax("Invalid function definition: %s", line);
        }
        if (symbolTable.containsGlobal(functionName) || symbolTable.isLocalName(functionName)) {
            throw MlException.syntax("Variable name conflicts with a function name: %s", functionName);
        }

        String parameterText;
        if (rest.startsWith("(")) {
            if (!rest.endsWith(")")) {
                throw MlException.syntax("Invalid function definition: %s", line);
            }
            parameterText = rest.substring(1, rest.length() - 1);
            log.code("Function definition with parentheses: %s", functionName);
        } else {
            parameterText = rest;
            log.code("Function definition without parentheses: %s", functionName);
        }

        List<String> parameters = new ArrayList<>();
        for (String param : parameterText.split("[\\s,]+")) {
            if (param.isEmpty()) {
                continue;
            }
            if (!MlUtils.isValidIdentifier(param)) {
                throw MlException.syntax("Invalid parameter in function: %s", param);
            }
            if (param.equals(functionName) || symbolTable.containsFunction(param)) {
                throw MlException.syntax("Variable name conflicts with a function name: %s", param);
            }
            parameters.add(param);
        }

        FunctionEntry function = symbolTable.addFunction(functionName, parameters);

        symbolTable.openScope();
        try {
            for (String param : parameters) {
                symbolTable.addLocal(param, SymbolTable.MlType.UNKNOWN);
            }
            for (String bodyLine : MlCorpoFuncao.read(cursor, functionName)) {
                if (MlUtils.isBlank(bodyLine) || MlUtils.isComment(bodyLine)) {
                    log.code("Comment - %s", bodyLine);
                    continue;
                }
                checkLine(bodyLine);
                // return x, return(x); uma atribuicao a returnValue nao conta
                if (bodyLine.startsWith(MlUtils.RETURN_KEYWORD) && !MlUtils.isAssignment(bodyLine)) {
                    function.markReturn();
                }
                function.appendBody(comando.translate(bodyLine));
            }
        } finally {
            symbolTable.closeScope();
        }
    }
}
