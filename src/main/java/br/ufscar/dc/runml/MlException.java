package br.ufscar.dc.runml;

/** Erro fatal da traducao ou da execucao de um programa ml. */
public class MlException extends RuntimeException {

    public enum Tipo {
        SYNTAX("! Error [SYNTAX] : "),
        FILE("! Error [FILE] : ");

        private final String prefixo;

        Tipo(String prefixo) {
            this.prefixo = prefixo;
        }

        public String getPrefixo() {
            return prefixo;
        }
    }

    private final Tipo tipo;

    public MlException(Tipo tipo, String message) {
        super(message);
        this.tipo = tipo;
    }

    public MlException(Tipo tipo, String message, Throwable cause) {
        super(message, cause);
        this.tipo = tipo;
    }

    public static MlException syntax(String format, Object... args) {
        return new MlException(Tipo.SYNTAX, String.format(format, args));
    }

    public static MlException file(String format, Object... args) {
        return new MlException(Tipo.FILE, String.format(format, args));
    }

    public Tipo getTipo() {
        return tipo;
    }

    /** Linha pronta para o fluxo de diagnostico, ex.: "! Error [SYNTAX] : Invalid variable name: 9a". */
    public String getDiagnostico() {
        return tipo.getPrefixo() + getMessage();
    }
}
