package beautify.web.graph;

/**
 * Pan/zoom state of a viewer: screen = logical * scale + (x, y).
 */
public class ViewTransform {

    public static final double MIN_SCALE = 0.1;
    public static final double MAX_SCALE = 5;

    private final double x;
    private final double y;
    private final double scale;

    public ViewTransform(double x, double y, double scale) {
        this.x = x;
        this.y = y;
        this.scale = scale;
    }

    public static ViewTransform initial() {
        return new ViewTransform(20, 20, 1);
    }

    public double getX() { return x; }
    public double getY() { return y; }
    public double getScale() { return scale; }

    public ViewTransform panBy(double dx, double dy) {
        return new ViewTransform(x + dx, y + dy, scale);
    }

    public ViewTransform zoomBy(double factor) {
        return new ViewTransform(x, y, Math.max(MIN_SCALE, Math.min(MAX_SCALE, scale * factor)));
    }

    @Override
    public String toString() {
        return "ViewTransform{x=" + x + ", y=" + y + ", scale=" + scale + '}';
    }
}
