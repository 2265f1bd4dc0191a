package br.ufscar.dc.runml;

import java.util.ArrayList;
import java.util.List;

import br.ufscar.dc.runml.SymbolTable.FunctionEntry;
import br.ufscar.dc.runml.SymbolTable.MlType;

/** Traduz um comando ml (atribuicao, print, return ou chamada) para C. Usado pelas duas passadas. */
public class MlComando {

    private final SymbolTable symbolTable;
    private final MlExpressao expressao;
    private final MlLog log;

    public MlComando(SymbolTable symbolTable, MlLog log) {
        this.symbolTable = symbolTable;
        this.expressao = new MlExpressao(log);
        this.log = log;
    }

    public String translate(String line) {
        StringBuilder output = new StringBuilder();
        if (MlUtils.isAssignment(line)) {
            translateAssignment(line, output);
        } else if (MlUtils.isPrint(line)) {
            String expr = line.substring(MlUtils.PRINT_KEYWORD.length() + 1);
            log.code("Print - Expression: %s", expr);
            generatePrintStatement(expr, output);
        } else if (MlUtils.isReturn(line)) {
            String expr = line.substring(MlUtils.RETURN_KEYWORD.length() + 1);
            log.code("Return - Expression: %s", expr);
            output.append("return ").append(expressao.translate(expr)).append(";\n");
        } else if (MlUtils.isCall(line)) {
            String call = line.trim();
            log.code("Function Call - %s", call);
            expressao.validate(call);
            determineParameterTypes(call);
            output.append(call).append(";\n");
        } else {
            throw MlException.syntax("Unrecognized statement: %s", line);
        }
        return output.toString();
    }

    private void translateAssignment(String line, StringBuilder output) {
        String[] parts = splitAssignment(line);
        String identifier = parts[0];
        String expr = parts[1];
        log.code("Assignment - Identifier: %s, Expression: %s", identifier, expr);

        if (symbolTable.getVariableType(identifier) == null) {
            storeVariable(line, false);
            MlType type = symbolTable.getVariableType(identifier);
            output.append(type.getCType()).append(" ").append(identifier).append(" = ");
        } else {
            output.append(identifier).append(" = ");
        }
        output.append(expressao.translate(expr)).append(";\n");
    }

    /**
     * Valida e registra a variavel de uma atribuicao no escopo global ou no
     * escopo local aberto.
     */
    public void storeVariable(String line, boolean global) {
        String[] parts = splitAssignment(line);
        String identifier = parts[0];
        String expr = parts[1];

        if (!MlUtils.isValidIdentifier(identifier)) {
            throw MlException.syntax("Invalid variable name: %s", identifier);
        }
        if (symbolTable.containsFunction(identifier)) {
            throw MlException.syntax("Variable name conflicts with a function name: %s", identifier);
        }

        MlType type = MlUtils.inferType(expr);
        if (!MlUtils.checkTypeConsistency(type, expr)) {
            throw MlException.syntax("Type mismatch for variable %s: expected %s but got %s",
                    identifier, type.getCType(), MlUtils.inferType(expr).getCType());
        }

        if (global) {
            symbolTable.addGlobal(identifier, type);
        } else {
            symbolTable.addLocal(identifier, type);
        }
    }

    /**
     * Tipos dos argumentos de uma chamada viram os tipos dos parametros da
     * funcao chamada, na mesma posicao.
     */
    public void determineParameterTypes(String call) {
        int open = call.indexOf('(');
        int close = call.lastIndexOf(')');
        if (open < 0 || close < open) {
            return;
        }
        String name = call.substring(0, open).trim();
        FunctionEntry function = symbolTable.getFunction(name);
        if (function == null) {
            return;
        }
        List<MlType> argumentTypes = new ArrayList<>();
        for (String argument : MlUtils.splitArguments(call.substring(open + 1, close))) {
            argumentTypes.add(MlUtils.inferType(argument));
        }
        function.inferFromCall(argumentTypes);
        log.code("Call site of %s - parameter types: %s, return type: %s",
                name, function.getParameterTypes(), function.getReturnType());
    }

    // O valor passa por um double temporario e o formato e decidido em tempo de execucao.
    private void generatePrintStatement(String expr, StringBuilder output) {
        output.append("{\n");
        output.append("double temp_value;\n");
        output.append("temp_value = ").append(expressao.translate(expr)).append(";\n");
        output.append("if (fabs(temp_value - (int)temp_value) < 1e-6) {\n");
        output.append("printf(\"%d\\n\", (int)temp_value);\n");
        output.append("} else {\n");
        output.append("printf(\"%.6f\\n\", temp_value);\n");
        output.append("}\n");
        output.append("}\n");
    }

    private static String[] splitAssignment(String line) {
        int marker = line.indexOf(MlUtils.ASSIGNMENT);
        String identifier = line.substring(0, marker).trim();
        String expr = line.substring(marker + MlUtils.ASSIGNMENT.length()).trim();
        if (identifier.isEmpty() || expr.isEmpty()) {
            throw MlException.syntax("Invalid assignment: %s", line);
        }
        return new String[] { identifier, expr };
    }
}
