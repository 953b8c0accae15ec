package eu.virtualparadox.notedraft.rag.embed;

import ai.djl.huggingface.tokenizers.Encoding;
import ai.djl.huggingface.tokenizers.HuggingFaceTokenizer;
import ai.onnxruntime.OnnxTensor;
import ai.onnxruntime.OrtEnvironment;
import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtSession;
import eu.virtualparadox.notedraft.application.config.ApplicationConfig;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Sentence embeddings from a local ONNX encoder ({@code models/retriever/model.onnx}
 * plus its {@code tokenizer.json}). Token vectors are mean pooled over the attention
 * mask and normalized. Only created when semantic ranking is switched on.
 */
@Slf4j
@Service
@ConditionalOnProperty(prefix = "notedraft.ranking", name = "semantic-enabled", havingValue = "true")
public class OnnxEmbeddingService implements EmbeddingService {

    private static final int MAX_LEN = 512;
    private static final int BATCH_SIZE = 16;

    private final Path modelPath;
    private final Path tokenizerPath;

    private OrtEnvironment env;
    private OrtSession session;
    private HuggingFaceTokenizer tokenizer;

    public OnnxEmbeddingService(final ApplicationConfig config) {
        final Path retrieverModelRoot = config.getModels().resolve("retriever");
        this.modelPath = retrieverModelRoot.resolve("model.onnx");
        this.tokenizerPath = retrieverModelRoot.resolve("tokenizer.json");
    }

    @PostConstruct
    public void init() throws IOException, OrtException {
        this.env = OrtEnvironment.getEnvironment();

        final OrtSession.SessionOptions options = new OrtSession.SessionOptions();
        // leave one core for the request threads
        final int intraThreads = Math.max(1, Runtime.getRuntime().availableProcessors() - 1);
        options.setIntraOpNumThreads(intraThreads);
        options.setInterOpNumThreads(1);

        this.session = env.createSession(modelPath.toString(), options);
        this.tokenizer = HuggingFaceTokenizer.newInstance(tokenizerPath);

        log.info("Loaded ONNX embedding model {} with {} intra-op threads", modelPath, intraThreads);
        log.debug("Model expects inputs: {}", session.getInputNames());
    }

    @PreDestroy
    public void cleanup() throws OrtException {
        if (session != null) {
            session.close();
        }
        if (tokenizer != null) {
            tokenizer.close();
        }
    }

    @Override
    public List<float[]> embed(final List<String> texts) {
        final List<float[]> result = new ArrayList<>(texts.size());
        for (int from = 0; from < texts.size(); from += BATCH_SIZE) {
            result.addAll(embedBatch(texts.subList(from, Math.min(texts.size(), from + BATCH_SIZE))));
        }
        return result;
    }

    /**
     * Token ids, attention mask and (all zero) token type ids, padded to the longest text.
     */
    private record EncodedBatch(long[][] inputIds, long[][] attentionMask, long[][] tokenTypes) {

        int size() {
            return inputIds.length;
        }
    }

    private List<float[]> embedBatch(final List<String> texts) {
        final EncodedBatch batch = encode(texts);
        try (OnnxTensor inputIds = OnnxTensor.createTensor(env, batch.inputIds());
             OnnxTensor attentionMask = OnnxTensor.createTensor(env, batch.attentionMask());
             OnnxTensor tokenTypes = OnnxTensor.createTensor(env, batch.tokenTypes())) {

            final Map<String, OnnxTensor> inputs = new HashMap<>();
            for (String name : session.getInputNames()) {
                switch (name) {
                    case "input_ids" -> inputs.put(name, inputIds);
                    case "attention_mask" -> inputs.put(name, attentionMask);
                    case "token_type_ids" -> inputs.put(name, tokenTypes);
                    default -> log.debug("Ignoring unknown model input {}", name);
                }
            }

            try (OrtSession.Result result = session.run(inputs)) {
                final float[][][] hidden = (float[][][]) result.get(0).getValue();
                final List<float[]> vectors = new ArrayList<>(batch.size());
                for (int i = 0; i < batch.size(); i++) {
                    vectors.add(pool(hidden[i], batch.attentionMask()[i]));
                }
                return vectors;
            }
        }
        catch (OrtException e) {
            throw new IllegalStateException("Embedding of " + texts.size() + " texts failed", e);
        }
    }

    private EncodedBatch encode(final List<String> texts) {
        final List<Encoding> encodings = texts.stream().map(tokenizer::encode).toList();
        final int width = Math.min(MAX_LEN, encodings.stream().mapToInt(e -> e.getIds().length).max().orElse(0));

        final long[][] ids = new long[encodings.size()][width];
        final long[][] mask = new long[encodings.size()][width];
        for (int i = 0; i < encodings.size(); i++) {
            final Encoding encoding = encodings.get(i);
            final int len = Math.min(width, encoding.getIds().length);
            System.arraycopy(encoding.getIds(), 0, ids[i], 0, len);
            System.arraycopy(encoding.getAttentionMask(), 0, mask[i], 0, len);
        }
        return new EncodedBatch(ids, mask, new long[encodings.size()][width]);
    }

    /**
     * Mean of the unmasked token vectors, scaled to unit length.
     */
    static float[] pool(final float[][] tokens, final long[] mask) {
        final float[] sum = new float[tokens[0].length];
        int count = 0;
        for (int t = 0; t < tokens.length && t < mask.length; t++) {
            if (mask[t] == 0) {
                continue;
            }
            count++;
            for (int d = 0; d < sum.length; d++) {
                sum[d] += tokens[t][d];
            }
        }
        double squares = 0;
        for (float v : sum) {
            squares += (double) v * v;
        }
        // the mean only rescales the sum, so normalizing the sum is enough
        if (count == 0 || squares == 0) {
            return sum;
        }
        final float scale = (float) (1.0 / Math.sqrt(squares));
        for (int d = 0; d < sum.length; d++) {
            sum[d] *= scale;
        }
        return sum;
    }
}
