package com.nesh.catalog.render;

/**
 * One step of chapter rendering. Rules run in a fixed order; a rule that throws is skipped and its
 * input passes through.
 */
public interface RenderRule {

    String name();

    String apply(String text, RenderContext context);
}
