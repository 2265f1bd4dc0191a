package br.ufscar.dc.runml;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/** Tabela de símbolos de uma traducao: variaveis globais, escopo local corrente e funcoes */
public class SymbolTable {

    public static final int MAX_GLOBAL_VARS = 50;
    public static final int MAX_LOCAL_VARS = 50;
    public static final int MAX_FUNCTIONS = 50;
    public static final int MAX_PARAMETERS = 50;

    public enum MlType {
        INTEGER("int"),
        REAL("double"),
        UNKNOWN("unknown"); // ainda nao inferido por nenhuma chamada

        private final String cType;

        MlType(String cType) {
            this.cType = cType;
        }

        public String getCType() {
            return cType;
        }
    }

    static class VariableEntry {
        final String name;
        final MlType type;

        VariableEntry(String name, MlType type) {
            this.name = name;
            this.type = type;
        }
    }

    /** Funcao declarada no programa ml. O corpo ja fica guardado traduzido para C. */
    public static class FunctionEntry {
        private final String name;
        private final List<String> parameters;
        private final List<MlType> parameterTypes;
        private MlType returnType;
        private final StringBuilder body;
        private boolean hasReturn;

        private FunctionEntry(String name, List<String> parameters) {
            this.name = name;
            this.parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
            this.parameterTypes = new ArrayList<>();
            for (int i = 0; i < parameters.size(); i++) {
                parameterTypes.add(MlType.UNKNOWN);
            }
            this.returnType = MlType.UNKNOWN;
            this.body = new StringBuilder();
            this.hasReturn = false;
        }

        public String getName() {
            return name;
        }

        public List<String> getParameters() {
            return parameters;
        }

        public List<MlType> getParameterTypes() {
            return Collections.unmodifiableList(parameterTypes);
        }

        public MlType getReturnType() {
            return returnType;
        }

        public String getBody() {
            return body.toString();
        }

        public boolean hasReturn() {
            return hasReturn;
        }

        void appendBody(String translated) {
            body.append(translated);
        }

        void markReturn() {
            hasReturn = true;
        }

        /** Tipos vindos de uma chamada; argumentos alem dos parametros declarados sao ignorados. */
        void inferFromCall(List<MlType> argumentTypes) {
            int n = Math.min(argumentTypes.size(), parameterTypes.size());
            for (int i = 0; i < n; i++) {
                parameterTypes.set(i, argumentTypes.get(i));
            }
            // retorno = tipo do primeiro parametro
            if (!parameterTypes.isEmpty()) {
                returnType = parameterTypes.get(0);
            }
        }

        /** Nenhuma chamada observada antes da emissao: tudo vira double. */
        void resolveSignature() {
            if (parameterTypes.isEmpty() || parameterTypes.get(0) == MlType.UNKNOWN) {
                for (int i = 0; i < parameterTypes.size(); i++) {
                    parameterTypes.set(i, MlType.REAL);
                }
                returnType = MlType.REAL;
                return;
            }
            // chamada com menos argumentos que parametros
            for (int i = 1; i < parameterTypes.size(); i++) {
                if (parameterTypes.get(i) == MlType.UNKNOWN) {
                    parameterTypes.set(i, MlType.REAL);
                }
            }
        }
    }

    private final Map<String, VariableEntry> globals;
    private final Deque<Map<String, VariableEntry>> scopes;
    private final Map<String, FunctionEntry> functions;
    private final Map<Integer, String> programArguments;
    // todo nome local ja declarado em qualquer escopo, parametros inclusive
    private final Set<String> localNames;

    public SymbolTable() {
        this.globals = new LinkedHashMap<>();
        this.scopes = new ArrayDeque<>();
        this.functions = new LinkedHashMap<>();
        this.programArguments = new TreeMap<>();
        this.localNames = new HashSet<>();
    }

    public void openScope() {
        scopes.push(new LinkedHashMap<>());
    }

    public void closeScope() {
        if (!scopes.isEmpty()) scopes.pop();
    }

    /** Insere variavel global; nomes ja registrados sao mantidos com o primeiro tipo visto */
    public void addGlobal(String name, MlType type) {
        if (globals.containsKey(name)) {
            return;
        }
        if (globals.size() >= MAX_GLOBAL_VARS) {
            throw MlException.syntax("Too many variables defined.");
        }
        globals.put(name, new VariableEntry(name, type));
    }

    /** Insere variavel no escopo local corrente */
    public void addLocal(String name, MlType type) {
        Map<String, VariableEntry> scope = scopes.peek();
        if (scope == null) {
            throw new IllegalStateException("No local scope open for " + name);
        }
        if (scope.containsKey(name)) {
            return;
        }
        if (scope.size() >= MAX_LOCAL_VARS) {
            throw MlException.syntax("Too many variables defined.");
        }
        scope.put(name, new VariableEntry(name, type));
        localNames.add(name);
    }

    public boolean containsGlobal(String name) {
        return globals.containsKey(name);
    }

    /** Verdadeiro se algum escopo local, ja fechado ou nao, declarou o nome. */
    public boolean isLocalName(String name) {
        return localNames.contains(name);
    }

    public boolean containsInCurrentScope(String name) {
        return scopes.peek() != null && scopes.peek().containsKey(name);
    }

    /** Local corrente primeiro, depois global; null se o nome ainda nao existe. */
    public MlType getVariableType(String name) {
        if (containsInCurrentScope(name)) {
            return scopes.peek().get(name).type;
        }
        if (globals.containsKey(name)) {
            return globals.get(name).type;
        }
        return null;
    }

    public List<String> getGlobalNames() {
        return new ArrayList<>(globals.keySet());
    }

    public MlType getGlobalType(String name) {
        VariableEntry entry = globals.get(name);
        return entry != null ? entry.type : null;
    }

    public FunctionEntry addFunction(String name, List<String> parameters) {
        if (functions.containsKey(name)) {
            throw MlException.syntax("Function already defined: %s", name);
        }
        if (functions.size() >= MAX_FUNCTIONS) {
            throw MlException.syntax("Too many functions defined.");
        }
        if (parameters.size() > MAX_PARAMETERS) {
            throw MlException.syntax("Too many parameters in function: %s", name);
        }
        FunctionEntry entry = new FunctionEntry(name, parameters);
        functions.put(name, entry);
        return entry;
    }

    public boolean containsFunction(String name) {
        return functions.containsKey(name);
    }

    public FunctionEntry getFunction(String name) {
        return functions.get(name);
    }

    public List<FunctionEntry> getFunctions() {
        return new ArrayList<>(functions.values());
    }

    /** argN vira uma global double alimentada por argv[N + 1] no main gerado */
    public void addProgramArgument(int index, String name) {
        if (programArguments.containsKey(index)) {
            return;
        }
        addGlobal(name, MlType.REAL);
        programArguments.put(index, name);
    }

    public Map<Integer, String> getProgramArguments() {
        return Collections.unmodifiableMap(programArguments);
    }
}
