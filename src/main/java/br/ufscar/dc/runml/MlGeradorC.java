package br.ufscar.dc.runml;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import br.ufscar.dc.runml.SymbolTable.FunctionEntry;

/** Segunda passada: gera o programa C completo a partir da tabela montada pela primeira. */
public class MlGeradorC {

    private final StringBuilder output;
    private final SymbolTable symbolTable;
    private final MlComando comando;
    private final MlLog log;

    public MlGeradorC(MlSemantico semantico, MlLog log) {
        this.output = new StringBuilder();
        this.symbolTable = semantico.getSymbolTable();
        this.comando = new MlComando(symbolTable, log);
        this.log = log;
    }

    public String getOutput() {
        return output.toString();
    }

    public void generate(LineCursor cursor) {
        log.info("Starting second pass to generate C code");
        output.append("#include <stdio.h>\n");
        output.append("#include <stdlib.h>\n");
        output.append("#include <math.h>\n\n");

        generateGlobalVariables();
        generateFunctionPrototypesAndCode();

        output.append("int main(int argc, char *argv[]) {\n");
        generateProgramArguments();
        symbolTable.openScope();
        try {
            generateMainCode(cursor);
        } finally {
            symbolTable.closeScope();
        }
        output.append("return 0;\n");
        output.append("}\n");
    }

    private void generateGlobalVariables() {
        for (String name : symbolTable.getGlobalNames()) {
            output.append(symbolTable.getGlobalType(name).getCType()).append(" ").append(name).append(" = 0.0;\n");
        }
        output.append("\n");
    }

    private void generateFunctionPrototypesAndCode() {
        for (FunctionEntry function : symbolTable.getFunctions()) {
            log.code("Generating prototype and code for function: %s", function.getName());
            function.resolveSignature();

            String signature = signature(function);
            output.append(signature).append(";\n");
            output.append(signature).append(" {\n");
            output.append(function.getBody());
            if (!function.hasReturn()) {
                output.append("return 0;\n");
            }
            output.append("}\n\n");
        }
    }

    private String signature(FunctionEntry function) {
        List<String> params = IntStream.range(0, function.getParameters().size())
            .mapToObj(i -> function.getParameterTypes().get(i).getCType() + " " + function.getParameters().get(i))
            .collect(Collectors.toList());
        return function.getReturnType().getCType() + " " + function.getName() + "(" + String.join(", ", params) + ")";
    }

    private void generateProgramArguments() {
        for (Map.Entry<Integer, String> arg : symbolTable.getProgramArguments().entrySet()) {
            int argvIndex = arg.getKey() + 1;
            output.append("if (argc > ").append(argvIndex).append(") { ")
                .append(arg.getValue()).append(" = atof(argv[").append(argvIndex).append("]); }\n");
        }
    }

    private void generateMainCode(LineCursor cursor) {
        while (cursor.hasNext()) {
            String line = cursor.next();

            if (MlUtils.isFunctionHeader(line)) {
                // corpo ja traduzido na primeira passada
                MlCorpoFuncao.read(cursor, line);
                continue;
            }
            if (MlUtils.isComment(line)) {
                log.code("Comment - %s", line);
                continue;
            }
            if (MlUtils.isBlank(line)) {
                continue;
            }
            output.append(comando.translate(line));
        }
    }
}
