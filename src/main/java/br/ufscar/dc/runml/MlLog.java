package br.ufscar.dc.runml;

import java.io.PrintWriter;

/** Log de depuracao do tradutor; so escreve quando o modo verboso esta ligado. */
public class MlLog {

    public enum Tipo {
        INFO("@ Debug [INFO] : "),
        CODE("@ Debug [CODE] : ");

        private final String prefixo;

        Tipo(String prefixo) {
            this.prefixo = prefixo;
        }
    }

    private final PrintWriter pw;
    private final boolean verbose;

    public MlLog(PrintWriter pw, boolean verbose) {
        this.pw = pw;
        this.verbose = verbose;
    }

    /** Log que descarta tudo, usado quando ninguem pediu -v. */
    public static MlLog silencioso() {
        return new MlLog(null, false);
    }

    public boolean isVerbose() {
        return verbose;
    }

    public void info(String format, Object... args) {
        log(Tipo.INFO, format, args);
    }

    public void code(String format, Object... args) {
        log(Tipo.CODE, format, args);
    }

    private void log(Tipo tipo, String format, Object... args) {
        if (!verbose) {
            return;
        }
        pw.println(tipo.prefixo + String.format(format, args));
        pw.flush();
    }
}
