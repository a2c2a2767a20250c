package com.helmet.corpus.generator;

import com.helmet.corpus.model.Stage;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Component
public class GeneratorRegistry {

    private final Map<Stage, ArtifactGenerator> generators = new EnumMap<>(Stage.class);

    public GeneratorRegistry(List<ArtifactGenerator> generators) {
        for (ArtifactGenerator generator : generators) {
            ArtifactGenerator previous = this.generators.put(generator.stage(), generator);
            if (previous != null) {
                throw new IllegalStateException("Two generators registered for stage " + generator.stage().stageName());
            }
        }
    }

    public ArtifactGenerator forStage(Stage stage) {
        ArtifactGenerator generator = generators.get(stage);
        if (generator == null) {
            throw new IllegalArgumentException("No generator for stage " + stage.stageName());
        }
        return generator;
    }
}
