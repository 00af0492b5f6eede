package com.talewright.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * One planned scene from the outlining phase.
 *
 * @param sceneNumber     1-based position in the plan
 * @param title           scene title
 * @param summary         what happens in the scene
 * @param characters      canonical names of characters appearing in the scene
 * @param targetWordCount desired length of the finished scene
 */
public record SceneOutline(
    int sceneNumber,
    String title,
    String summary,
    List<String> characters,
    int targetWordCount
) implements Serializable {
}
