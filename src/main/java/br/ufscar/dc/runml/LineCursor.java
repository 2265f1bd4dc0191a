package br.ufscar.dc.runml;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Leitor de linhas com buffer de leitura antecipada.
 * readLine() ja remove o terminador ("\n" ou "\r\n").
 */
public class LineCursor implements Closeable {

    private final BufferedReader reader;
    private final List<String> lookahead;
    private int lineNumber;

    public LineCursor(BufferedReader reader) {
        this.reader = reader;
        this.lookahead = new ArrayList<>();
        this.lineNumber = 0;
    }

    public static LineCursor open(Path path) throws IOException {
        return new LineCursor(Files.newBufferedReader(path, StandardCharsets.UTF_8));
    }

    public static LineCursor of(String source) {
        return new LineCursor(new BufferedReader(new StringReader(source)));
    }

    public boolean hasNext() {
        return peek(0) != null;
    }

    public String next() {
        String line = peek(0);
        if (line == null) {
            throw new IllegalStateException("No more lines after line " + lineNumber);
        }
        lookahead.remove(0);
        lineNumber++;
        return line;
    }

    /** Linha k posicoes a frente sem consumir; peek(0) e a proxima. null depois do fim. */
    public String peek(int k) {
        while (lookahead.size() <= k) {
            String line = readLine();
            if (line == null) {
                return null;
            }
            lookahead.add(line);
        }
        return lookahead.get(k);
    }

    /** Numero (a partir de 1) da ultima linha devolvida por next(). */
    public int getLineNumber() {
        return lineNumber;
    }

    private String readLine() {
        try {
            return reader.readLine();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Override
    public void close() throws IOException {
        reader.close();
    }
}
