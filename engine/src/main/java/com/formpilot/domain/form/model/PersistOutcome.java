package com.formpilot.domain.form.model;

import java.util.List;

/**
 * Result of merging reviewed items into the learned answers.
 *
 * @param savedCount   items merged into the store
 * @param skipped      questions left out because they failed validation
 * @param written      true if the profile document was rewritten on disk
 */
public record PersistOutcome(int savedCount, List<String> skipped, boolean written) {}
