// This is the reader for EdgeCon graph files.
//
//   # comment
//   4          <- number of nodes
//   0 1 X      <- heterogeneous edge
//   2 3 H      <- homogeneous edge
//
// An edge without a type column is heterogeneous.

package edgecon;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.FileReader;
import java.io.IOException;
import java.io.Reader;

public class GraphReader {
    private static final Logger log = LogManager.getFormatterLogger();

    public static EdgeConGraph read(String fileName) throws IOException {
        try (BufferedReader br = new BufferedReader(new FileReader(fileName))) {
            EdgeConGraph graph = read(br);
            log.info("Loaded %s: %d nodes, %d edges, %d homogeneous components",
                    fileName, graph.numNodes(), graph.numEdges(), graph.numHomogeneousComponents());
            return graph;
        }
    }

    public static EdgeConGraph read(Reader reader) throws IOException {
        BufferedReader br = reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);
        EdgeConGraph graph = null;
        String line;
        int lineNumber = 0;

        while ((line = br.readLine()) != null) {
            lineNumber++;
            line = line.trim();
            if (line.isEmpty() || line.startsWith("#"))
                continue;

            String[] tokens = line.split("\\s+");
            if (graph == null) {
                if (tokens.length != 1)
                    throw new GraphFormatException(lineNumber, "expected the number of nodes, got '" + line + "'");
                int numNodes = parseInt(tokens[0], lineNumber);
                if (numNodes < 0)
                    throw new GraphFormatException(lineNumber, "negative number of nodes " + numNodes);
                graph = new EdgeConGraph(numNodes);
                continue;
            }

            if (tokens.length < 2 || tokens.length > 3)
                throw new GraphFormatException(lineNumber, "expected 'u v [H|X]', got '" + line + "'");
            int u = parseInt(tokens[0], lineNumber);
            int v = parseInt(tokens[1], lineNumber);
            boolean homogeneous = false;
            if (tokens.length == 3) {
                if (tokens[2].equalsIgnoreCase("H"))
                    homogeneous = true;
                else if (!tokens[2].equalsIgnoreCase("X"))
                    throw new GraphFormatException(lineNumber, "unknown edge type '" + tokens[2] + "'");
            }
            try {
                graph.addEdge(u, v, homogeneous);
            } catch (IllegalArgumentException e) {
                throw new GraphFormatException(lineNumber, e.getMessage(), e);
            }
        }

        if (graph == null)
            throw new GraphFormatException(lineNumber, "missing number of nodes");
        graph.recomputeHomogeneousComponents();
        return graph;
    }

    private static int parseInt(String token, int lineNumber) throws GraphFormatException {
        try {
            return Integer.parseInt(token);
        } catch (NumberFormatException e) {
            throw new GraphFormatException(lineNumber, "not a number '" + token + "'", e);
        }
    }
}
