package eu.virtualparadox.notedraft.application.config;

import eu.virtualparadox.notedraft.ingest.chunker.EPrivacyMode;
import eu.virtualparadox.notedraft.rag.rank.ERankingStrategy;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

@Configuration
@ConfigurationProperties(prefix = "notedraft")
@Getter @Setter
public class ApplicationConfig {

    private Path models;

    private Chunking chunking = new Chunking();
    private Ranking ranking = new Ranking();
    private Generation generation = new Generation();
    private Scheduler scheduler = new Scheduler();

    @PostConstruct
    public void ensureFolders() throws IOException {
        if (models != null && ranking.isSemanticEnabled()) Files.createDirectories(models);
    }

    @Getter @Setter
    public static class Chunking {
        private EPrivacyMode privacyMode = EPrivacyMode.STANDARD;
        private int standardWindow = 1200;
        private int standardOverlap = 200;
        private int fragmentWindow = 650;
        private int fragmentOverlap = 120;
    }

    @Getter @Setter
    public static class Ranking {
        private ERankingStrategy strategy = ERankingStrategy.WEIGHTED;
        private int evidenceLimit = 6;
        private boolean includeUnmatchedSources = true;
        private boolean semanticEnabled = false;
    }

    @Getter @Setter
    public static class Generation {
        private String model = "gpt-4o-mini";
        private int sectionMaxTokens = 2000;
        private int recoveryMaxTokens = 300;
        private int reviewMaxTokens = 600;
        private int answerMaxTokens = 800;
        private int evidenceMaxChars = 10000;
        private boolean liveDisplay = true;
        private boolean openQuestions = false;
        private boolean reviewAfterBatch = false;
    }

    @Getter @Setter
    public static class Scheduler {
        private int maxWorkers = 3;
    }
}
