package com.flamingo.ai.docstructure.service.structuring;

import com.flamingo.ai.docstructure.config.StructuringConfig;
import com.flamingo.ai.docstructure.service.model.Page;
import com.flamingo.ai.docstructure.service.model.PreprocessResult;
import java.util.List;

/**
 * Structures the positioned text of a document into functional groups of sections.
 *
 * <p>Runs normalization, header/footer removal, section segmentation and functional grouping in
 * sequence. Implementations are stateless; independent documents may be processed concurrently.
 */
public interface DocumentStructuringService {

  /**
   * Structures a document with the application's configured settings.
   *
   * @param pages contiguous pages numbered from 1
   * @return groups, removed patterns and diagnostics
   * @throws com.flamingo.ai.docstructure.exception.InvalidContentException if there are no pages
   *     or no spans
   * @throws com.flamingo.ai.docstructure.exception.StructuringException if a stage fails
   */
  PreprocessResult process(List<Page> pages);

  /**
   * Structures a document with caller-supplied settings.
   *
   * @param pages contiguous pages numbered from 1
   * @param config settings for this call; snapshotted before any stage runs
   * @return groups, removed patterns and diagnostics
   */
  PreprocessResult process(List<Page> pages, StructuringConfig config);
}
