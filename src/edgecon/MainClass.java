// This is the main class responsible for reading the config file and running one reduction.
//
// config.txt, one value per line:
//   graph file
//   depth bound k
//   solver timeout in seconds (0 for none)
//   PrintModelTrue / PrintModelFalse

package edgecon;

import edgecon.sat.BooleanSolver;
import edgecon.sat.Formula;
import edgecon.sat.SATResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.FileReader;
import java.io.IOException;
import java.util.Arrays;
import java.util.List;

public class MainClass {
    private static final Logger log = LogManager.getFormatterLogger();

    public static String ConfigFileName = "config.txt";
    public static String GraphFileName = "";
    public static int DepthBound = 0;
    public static int TimeoutSeconds = 0;
    public static boolean PrintModel = false;

    public static void main(String[] args) {
        if (args.length > 0)
            ConfigFileName = args[0];

        try {
            readConfig(ConfigFileName);
        } catch (IOException | RuntimeException ex) {
            log.error("Cannot read config file %s: %s", ConfigFileName, ex.getMessage());
            System.exit(1);
            return;
        }

        System.out.println("Graph: " + GraphFileName);
        System.out.println("Depth bound: " + DepthBound);
        System.out.println("Timeout (s): " + TimeoutSeconds);

        try {
            run();
        } catch (IOException ex) {
            log.error("Cannot load graph %s: %s", GraphFileName, ex.getMessage());
            System.exit(1);
        } catch (IllegalArgumentException ex) {
            log.error("Cannot reduce graph %s: %s", GraphFileName, ex.getMessage());
            System.exit(1);
        }
    }

    public static void readConfig(String fileName) throws IOException {
        try (BufferedReader br = new BufferedReader(new FileReader(fileName))) {
            GraphFileName = requireLine(br, "graph file").trim();
            DepthBound = Integer.parseInt(requireLine(br, "depth bound").trim());
            if (DepthBound < 0)
                throw new IOException("depth bound must not be negative, got " + DepthBound);
            TimeoutSeconds = Integer.parseInt(requireLine(br, "timeout").trim());

            String printModelS = br.readLine();
            PrintModel = printModelS != null && printModelS.trim().equals("PrintModelTrue");
        }
    }

    // returns the status reported by the solver
    public static SATResult.Status run() throws IOException {
        EdgeConGraph graph = GraphReader.read(GraphFileName);
        System.out.println("Nodes: " + graph.numNodes() + ", edges: " + graph.numEdges() +
                ", homogeneous components: " + graph.numHomogeneousComponents());

        BooleanSolver solver = new BooleanSolver(TimeoutSeconds);
        EdgeConReduction reduction = new EdgeConReduction(solver, graph, DepthBound);
        Formula formula = reduction.buildFormula();
        SATResult result = solver.solve(formula);

        System.out.println("Reduction time (ms): " + reduction.reductionTime / 1_000_000);
        System.out.println("SAT time (ms): " + solver.satTime / 1_000_000);
        System.out.println("CNF: " + solver.numCNFVariables + " variables, " + solver.numCNFClauses + " clauses");
        System.out.println("Answer: " + result.getStatus());

        if (result.isSatisfiable()) {
            int numComponents = graph.numHomogeneousComponents();
            if (PrintModel) {
                System.out.println("Parents: " + Arrays.toString(TranslatorDecoder.decodeParents(result.getModel(), numComponents)));
                System.out.println("Levels: " + Arrays.toString(TranslatorDecoder.decodeLevels(result.getModel(), numComponents)));
            }
            List<Edge> translators = TranslatorDecoder.decodeTranslatorAssignment(result, graph);
            System.out.println("Translators: " + translators);
            System.out.println("Homogeneous components after translation: " + graph.numHomogeneousComponents());
        }
        return result.getStatus();
    }

    private static String requireLine(BufferedReader br, String what) throws IOException {
        String line = br.readLine();
        if (line == null)
            throw new IOException("missing " + what);
        return line;
    }
}
