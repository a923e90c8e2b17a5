package dev.divertscan.tickets.materials;

import dev.divertscan.tickets.model.MaterialType;

/**
 * Outcome of classifying a free-text material description.
 *
 * @param materialType best matching material
 * @param confidence   heuristic score in [0, 1]
 * @param keywordHits  number of keywords of {@code materialType} found in the description
 */
public record MaterialClassification(MaterialType materialType, double confidence, int keywordHits) {
}
