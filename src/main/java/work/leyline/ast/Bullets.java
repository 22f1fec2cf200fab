package work.leyline.ast;

import java.util.List;
import java.util.Objects;

/**
 * Bullets of a list: either one bullet shared by every item, or one bullet per item.
 * Numbering is never re-derived, a per-item sequence holds the integers the author wrote.
 */
public record Bullets(Bullet shared, List<Bullet> sequence) {
    public Bullets {
        if ((shared == null) == (sequence == null)) {
            throw new IllegalArgumentException("bullets are either shared or per item");
        }
        sequence = sequence == null ? null : List.copyOf(sequence);
    }

    public static Bullets shared(Bullet bullet) {
        return new Bullets(Objects.requireNonNull(bullet, "bullet"), null);
    }

    public static Bullets perItem(List<Bullet> bullets) {
        return new Bullets(null, Objects.requireNonNull(bullets, "bullets"));
    }

    /** Collapses to {@link #shared(Bullet)} when every bullet is identical. */
    public static Bullets of(List<Bullet> bullets) {
        if (bullets.isEmpty()) {
            throw new IllegalArgumentException("a list needs at least one bullet");
        }
        Bullet first = bullets.get(0);
        for (Bullet bullet : bullets) {
            if (!bullet.equals(first)) {
                return perItem(bullets);
            }
        }
        return shared(first);
    }

    public boolean isShared() {
        return shared != null;
    }

    /** Bullet of the item at {@code index}. */
    public Bullet bulletAt(int index) {
        return isShared() ? shared : sequence.get(index);
    }

    @Override
    public String toString() {
        return isShared() ? "'" + shared + "'" : sequence.toString();
    }
}
