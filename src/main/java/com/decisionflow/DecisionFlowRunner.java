package com.decisionflow;

import com.decisionflow.adapter.spring.DecisionFlowProperties;
import com.decisionflow.compiler.CompilerSettings;
import com.decisionflow.compiler.DecisionCompiler;
import com.decisionflow.compiler.DecisionCompilerFactory;
import com.decisionflow.config.DecisionDocument;
import com.decisionflow.config.DecisionDocumentLoader;
import com.decisionflow.exception.DecisionFlowException;
import com.decisionflow.render.OutputFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;

import java.io.PrintStream;
import java.util.List;

/**
 * Command line front end.
 * <pre>
 * --data=&lt;json&gt;      inline document, e.g. {"Q1":"a?","logic":"Q1"}
 * --file=&lt;path&gt;      YAML or JSON document (classpath: prefix supported)
 * --dag[=true|false] print the DAG document instead of the diagram
 * --factor=true|false override OR-group factoring
 * </pre>
 * Without --data or --file the configured default document is compiled.
 */
public class DecisionFlowRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(DecisionFlowRunner.class);

    static final String DATA_OPTION = "data";
    static final String FILE_OPTION = "file";
    static final String DAG_OPTION = "dag";
    static final String FACTOR_OPTION = "factor";

    private final DecisionCompiler compiler;
    private final CompilerSettings settings;
    private final DecisionFlowProperties properties;
    private final PrintStream out;
    private int exitCode;

    public DecisionFlowRunner(DecisionCompiler compiler,
                              CompilerSettings settings,
                              DecisionFlowProperties properties,
                              PrintStream out) {
        this.compiler = compiler;
        this.settings = settings;
        this.properties = properties;
        this.out = out;
    }

    @Override
    public void run(ApplicationArguments args) {
        String dag = lastValue(args, DAG_OPTION);
        OutputFormat format = dag != null && isSet(dag) ? OutputFormat.DAG : OutputFormat.DIAGRAM;

        try {
            DecisionDocument document = resolveDocument(args);
            out.println(resolveCompiler(args).compile(document, format));
            exitCode = 0;
        } catch (DecisionFlowException e) {
            log.error("Compilation failed: {}", e.getMessage());
            exitCode = 1;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private DecisionDocument resolveDocument(ApplicationArguments args) {
        String data = lastValue(args, DATA_OPTION);
        if (data != null) {
            return DecisionDocumentLoader.fromJson(data);
        }
        String file = lastValue(args, FILE_OPTION);
        if (file != null) {
            return DecisionDocumentLoader.load(file);
        }
        return DecisionDocumentLoader.load(properties.getDocumentPath());
    }

    private DecisionCompiler resolveCompiler(ApplicationArguments args) {
        String factor = lastValue(args, FACTOR_OPTION);
        if (factor == null) {
            return compiler;
        }
        boolean enabled = isSet(factor);
        log.debug("Factoring overridden from command line: {}", enabled);
        return DecisionCompilerFactory.create(settings.withFactoring(enabled));
    }

    private String lastValue(ApplicationArguments args, String option) {
        if (!args.containsOption(option)) {
            return null;
        }
        List<String> values = args.getOptionValues(option);
        if (values == null || values.isEmpty()) {
            return "";
        }
        return values.get(values.size() - 1);
    }

    /**
     * A bare flag counts as true.
     */
    private boolean isSet(String value) {
        return value.isEmpty() || Boolean.parseBoolean(value);
    }
}
