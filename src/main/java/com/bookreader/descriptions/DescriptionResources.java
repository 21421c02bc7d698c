package com.bookreader.descriptions;

import com.bookreader.exception.InvalidExtractionRequestException;
import com.bookreader.nlp.DescriptionExtractionEngine;
import com.bookreader.nlp.core.CompleteDescription;
import com.bookreader.nlp.core.ExtractionResult;
import com.bookreader.nlp.registry.ProcessorStatus;
import com.bookreader.nlp.scoring.DescriptionRanking;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.jboss.logging.Logger;

import java.util.List;

/**
 * REST resource for description extraction.
 *
 * <h2>Endpoints:</h2>
 * <ul>
 *   <li>{@code POST /descriptions/extract} - extract ranked descriptions from chapter text</li>
 *   <li>{@code GET /descriptions/processors} - startup state of each configured extractor</li>
 * </ul>
 *
 * <h2>Usage Example:</h2>
 * <pre>{@code
 * POST /descriptions/extract
 * Content-Type: application/json
 *
 * {
 *   "chapterId": "ch-12",
 *   "text": "Высокий темный замок возвышался на холме.",
 *   "mode": "ensemble",
 *   "illustrationBudget": 5
 * }
 * }</pre>
 */
@Path("/descriptions")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class DescriptionResources {

    private static final Logger LOG = Logger.getLogger(DescriptionResources.class);

    private final DescriptionExtractionEngine engine;

    @Inject
    public DescriptionResources(DescriptionExtractionEngine engine) {
        this.engine = engine;
    }

    /**
     * @return 200 with the result, possibly with no descriptions;
     *         400 for an unknown mode or invalid body;
     *         503 when no extractor is available
     */
    @POST
    @Path("/extract")
    public ExtractionResult extract(@Valid ExtractionRequest request) {
        if (request == null) {
            throw new InvalidExtractionRequestException("body", "request body is required");
        }
        LOG.infof("Extraction request: chapter=%s, length=%d, mode=%s, processor=%s",
            request.chapterId(), request.text().length(), request.mode(), request.processor());
        ExtractionResult result = engine.extract(request.text(), request.chapterId(), request.processor(),
            request.getProcessingMode());
        if (request.illustrationBudget() == null) {
            return result;
        }
        List<CompleteDescription> selected =
            DescriptionRanking.selectForIllustration(result.descriptions(), request.illustrationBudget());
        LOG.debugf("Illustration budget %d kept %d of %d descriptions",
            request.illustrationBudget().intValue(), selected.size(), result.descriptions().size());
        return result.withDescriptions(selected);
    }

    @GET
    @Path("/processors")
    public List<ProcessorStatus> processors() {
        return engine.getProcessorStatus();
    }
}
