package duneshear.physics.interpolation;

import duneshear.utils.GridArrays;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.index.hprtree.HPRtree;
import org.locationtech.jts.triangulate.DelaunayTriangulationBuilder;
import org.locationtech.jts.triangulate.quadedge.LocateFailureException;
import org.locationtech.jts.triangulate.quadedge.QuadEdgeSubdivision;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Triangulación de Delaunay de una nube de puntos fuente, reutilizable entre interpolaciones.
 * <p>
 * Los puntos se tratan como nube no estructurada (la rejilla 2D se aplana por filas), pero se
 * recuerda su forma (ny, nx) para validar los valores que se interpolen sobre ella.
 * <p>
 * Incluye:
 * <ul>
 * <li>Vecino a través de cada arista (opuesto al vértice k), necesario para Clough-Tocher.</li>
 * <li>Adyacencia de vértices en formato CSR, para la estimación de gradientes.</li>
 * <li>Índice espacial (HPRtree) sobre las envolventes de los triángulos para localizar puntos.</li>
 * </ul>
 * Inmutable tras la construcción.
 */
@Slf4j
public final class DelaunayMesh {

    /**
     * Holgura en coordenadas baricéntricas para aceptar puntos sobre aristas y vértices.
     */
    static final double CONTAINMENT_SLACK = 1e-10;

    @Getter
    private final int rows;
    @Getter
    private final int cols;
    private final double[] px;
    private final double[] py;
    private final int[][] triangles;
    private final int[][] neighbors;
    private final int[] adjacencyStart;
    private final int[] adjacency;
    private final HPRtree index;

    private DelaunayMesh(int rows, int cols, double[] px, double[] py, int[][] triangles) {
        this.rows = rows;
        this.cols = cols;
        this.px = px;
        this.py = py;
        this.triangles = triangles;
        this.neighbors = buildNeighbors(triangles);

        int[][] adj = buildAdjacency(px.length, triangles);
        this.adjacencyStart = adj[0];
        this.adjacency = adj[1];

        this.index = new HPRtree();
        for (int t = 0; t < triangles.length; t++) {
            int[] tri = triangles[t];
            Envelope env = new Envelope(px[tri[0]], px[tri[1]], py[tri[0]], py[tri[1]]);
            env.expandToInclude(px[tri[2]], py[tri[2]]);
            index.insert(env, t);
        }
        index.build();
    }

    /**
     * Triangula los nodos de una rejilla (ny, nx).
     */
    public static DelaunayMesh of(double[][] x, double[][] y) {
        if (!GridArrays.isRectangular(x) || !GridArrays.isRectangular(y) || !GridArrays.sameShape(x, y)) {
            throw new IllegalArgumentException("Las coordenadas fuente deben ser rectangulares y de igual forma.");
        }
        int rows = x.length;
        int cols = x[0].length;
        double[] px = GridArrays.flatten(x);
        double[] py = GridArrays.flatten(y);

        long start = System.currentTimeMillis();

        // Mapa coordenada -> índice original (el primero en caso de duplicados)
        Map<Coordinate, Integer> indexByCoordinate = new HashMap<>(px.length * 2);
        List<Coordinate> sites = new ArrayList<>(px.length);
        for (int i = 0; i < px.length; i++) {
            Coordinate c = new Coordinate(px[i], py[i]);
            if (indexByCoordinate.putIfAbsent(c, i) == null) {
                sites.add(c);
            }
        }

        DelaunayTriangulationBuilder builder = new DelaunayTriangulationBuilder();
        builder.setSites(sites);
        QuadEdgeSubdivision subdivision;
        try {
            subdivision = builder.getSubdivision();
        } catch (LocateFailureException e) {
            throw new IllegalArgumentException("No se pudo triangular la nube de puntos fuente.", e);
        }

        @SuppressWarnings("unchecked")
        List<Coordinate[]> triangleCoordinates = subdivision.getTriangleCoordinates(false);

        List<int[]> triangles = new ArrayList<>(triangleCoordinates.size());
        for (Coordinate[] ring : triangleCoordinates) {
            Integer a = indexByCoordinate.get(ring[0]);
            Integer b = indexByCoordinate.get(ring[1]);
            Integer c = indexByCoordinate.get(ring[2]);
            if (a == null || b == null || c == null || a.equals(b) || b.equals(c) || c.equals(a)) {
                continue;
            }
            triangles.add(new int[]{a, b, c});
        }

        log.debug("Triangulación de Delaunay: {} puntos, {} triángulos en {} ms",
                px.length, triangles.size(), System.currentTimeMillis() - start);

        if (triangles.isEmpty()) {
            throw new IllegalArgumentException("Los puntos fuente son colineales: no se puede triangular.");
        }
        return new DelaunayMesh(rows, cols, px, py, triangles.toArray(new int[0][]));
    }

    public int getPointCount() {
        return px.length;
    }

    public int getTriangleCount() {
        return triangles.length;
    }

    public double getPointX(int vertex) {
        return px[vertex];
    }

    public double getPointY(int vertex) {
        return py[vertex];
    }

    public int[] getTriangle(int triangle) {
        return triangles[triangle].clone();
    }

    int vertex(int triangle, int k) {
        return triangles[triangle][k];
    }

    /**
     * Triángulo vecino a través de la arista opuesta al vértice k, o -1 en el borde del casco.
     */
    int neighbor(int triangle, int k) {
        return neighbors[triangle][k];
    }

    int adjacencyStart(int vertex) {
        return adjacencyStart[vertex];
    }

    int adjacencyEnd(int vertex) {
        return adjacencyStart[vertex + 1];
    }

    int adjacent(int slot) {
        return adjacency[slot];
    }

    public boolean acceptsShape(double[][] values) {
        return GridArrays.isRectangular(values) && values.length == rows && values[0].length == cols;
    }

    /**
     * Localiza el triángulo que contiene (x, y).
     *
     * @param bary Salida: coordenadas baricéntricas respecto a los vértices 0, 1 y 2.
     * @return Índice del triángulo o -1 si el punto cae fuera del casco convexo.
     */
    public int locate(double x, double y, double[] bary) {
        @SuppressWarnings("unchecked")
        List<Object> candidates = index.query(new Envelope(x, x, y, y));
        for (Object candidate : candidates) {
            int t = (Integer) candidate;
            if (barycentric(t, x, y, bary) && isInside(bary)) {
                return t;
            }
        }
        return -1;
    }

    /**
     * Coordenadas baricéntricas de (x, y) respecto al triángulo t.
     *
     * @return false si el triángulo es degenerado.
     */
    boolean barycentric(int t, double x, double y, double[] out) {
        int[] tri = triangles[t];
        double x0 = px[tri[0]], y0 = py[tri[0]];
        double x1 = px[tri[1]], y1 = py[tri[1]];
        double x2 = px[tri[2]], y2 = py[tri[2]];

        double det = (y1 - y2) * (x0 - x2) + (x2 - x1) * (y0 - y2);
        double scale = Math.abs((x1 - x0) * (y2 - y0)) + Math.abs((y1 - y0) * (x2 - x0));
        if (Math.abs(det) <= 1e-14 * scale || det == 0.0) {
            return false;
        }
        out[0] = ((y1 - y2) * (x - x2) + (x2 - x1) * (y - y2)) / det;
        out[1] = ((y2 - y0) * (x - x2) + (x0 - x2) * (y - y2)) / det;
        out[2] = 1.0 - out[0] - out[1];
        return true;
    }

    private static boolean isInside(double[] b) {
        return b[0] >= -CONTAINMENT_SLACK && b[1] >= -CONTAINMENT_SLACK && b[2] >= -CONTAINMENT_SLACK;
    }

    private static int[][] buildNeighbors(int[][] triangles) {
        Map<Long, Integer> firstOwner = new HashMap<>(triangles.length * 3);
        int[][] neighbors = new int[triangles.length][3];
        for (int t = 0; t < triangles.length; t++) {
            neighbors[t][0] = neighbors[t][1] = neighbors[t][2] = -1;
        }
        for (int t = 0; t < triangles.length; t++) {
            for (int k = 0; k < 3; k++) {
                long key = edgeKey(triangles[t][(k + 1) % 3], triangles[t][(k + 2) % 3]);
                Integer other = firstOwner.putIfAbsent(key, t);
                if (other != null) {
                    neighbors[t][k] = other;
                    neighbors[other][oppositeSlot(triangles[other], key)] = t;
                }
            }
        }
        return neighbors;
    }

    private static int oppositeSlot(int[] tri, long key) {
        for (int k = 0; k < 3; k++) {
            if (edgeKey(tri[(k + 1) % 3], tri[(k + 2) % 3]) == key) return k;
        }
        throw new IllegalStateException("Arista inconsistente en la triangulación.");
    }

    private static long edgeKey(int a, int b) {
        int lo = Math.min(a, b);
        int hi = Math.max(a, b);
        return ((long) lo << 32) | (hi & 0xffffffffL);
    }

    /**
     * Adyacencia única de vértices a partir de las aristas de los triángulos (CSR).
     */
    private static int[][] buildAdjacency(int vertexCount, int[][] triangles) {
        List<Long> edges = new ArrayList<>(triangles.length * 3);
        Set<Long> seen = new HashSet<>(triangles.length * 3);
        for (int[] tri : triangles) {
            for (int k = 0; k < 3; k++) {
                long key = edgeKey(tri[k], tri[(k + 1) % 3]);
                if (seen.add(key)) edges.add(key);
            }
        }

        int[] degree = new int[vertexCount + 1];
        for (long e : edges) {
            degree[(int) (e >>> 32)]++;
            degree[(int) e]++;
        }
        int[] start = new int[vertexCount + 1];
        for (int v = 0; v < vertexCount; v++) {
            start[v + 1] = start[v] + degree[v];
        }
        int[] fill = start.clone();
        int[] adjacency = new int[start[vertexCount]];
        for (long e : edges) {
            int a = (int) (e >>> 32);
            int b = (int) e;
            adjacency[fill[a]++] = b;
            adjacency[fill[b]++] = a;
        }
        return new int[][]{start, adjacency};
    }
}
