package work.leyline.ast;

import java.util.Objects;

/**
 * A list bullet as the author wrote it: a symbol ({@code -} or {@code *}) or an integer
 * ({@code 3.} is kept as {@code 3}).
 */
public record Bullet(String symbol, Integer number) {
    public Bullet {
        if ((symbol == null) == (number == null)) {
            throw new IllegalArgumentException("bullet needs exactly one of symbol or number");
        }
    }

    public static Bullet symbol(String symbol) {
        return new Bullet(Objects.requireNonNull(symbol, "symbol"), null);
    }

    public static Bullet number(int number) {
        return new Bullet(null, number);
    }

    /** Parses a bullet literal such as {@code "-"} or {@code "12."}. */
    public static Bullet parse(String literal) {
        if (literal.endsWith(".")) {
            return number(Integer.parseInt(literal.substring(0, literal.length() - 1)));
        }
        return symbol(literal);
    }

    public boolean isNumbered() {
        return number != null;
    }

    @Override
    public String toString() {
        return isNumbered() ? number.toString() : symbol;
    }
}
