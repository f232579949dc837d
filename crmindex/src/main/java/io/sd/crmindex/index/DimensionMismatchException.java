package io.sd.crmindex.index;

/**
 * Vetores com dimensões diferentes na mesma geração, ou query com dimensão diferente da geração.
 */
public class DimensionMismatchException extends IndexException {

    private final int expected;
    private final int actual;

    public DimensionMismatchException(int expected, int actual) {
        super("Dimensão inconsistente: esperado " + expected + ", recebido " + actual);
        this.expected = expected;
        this.actual = actual;
    }

    public int getExpected() {
        return expected;
    }

    public int getActual() {
        return actual;
    }
}
