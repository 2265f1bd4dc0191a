package br.ufscar.dc.runml;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Opcoes de linha de comando: runml &lt;ml-file&gt; [-v] [numeros...] */
public class Opcoes {

    private final Path mlFile;
    private final boolean verbose;
    private final List<String> programArgs;

    private Opcoes(Path mlFile, boolean verbose, List<String> programArgs) {
        this.mlFile = mlFile;
        this.verbose = verbose;
        this.programArgs = Collections.unmodifiableList(programArgs);
    }

    /** null quando os argumentos nao seguem o uso esperado. */
    public static Opcoes parse(String[] args) {
        if (args.length < 1) {
            return null;
        }
        boolean verbose = false;
        List<String> programArgs = new ArrayList<>();
        for (int i = 1; i < args.length; i++) {
            if (args[i].equals("-v")) {
                verbose = true;
            } else if (isNumber(args[i])) {
                programArgs.add(args[i]);
            } else {
                return null;
            }
        }
        return new Opcoes(Paths.get(args[0]), verbose, programArgs);
    }

    public static String usage() {
        return "Usage: runml <ml-file> [-v] [numbers...]";
    }

    private static boolean isNumber(String s) {
        try {
            Double.parseDouble(s);
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    public Path getMlFile() {
        return mlFile;
    }

    public boolean isVerbose() {
        return verbose;
    }

    public List<String> getProgramArgs() {
        return programArgs;
    }
}
