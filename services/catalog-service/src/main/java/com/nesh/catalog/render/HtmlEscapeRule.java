package com.nesh.catalog.render;

import org.springframework.web.util.HtmlUtils;

public class HtmlEscapeRule implements RenderRule {

    @Override
    public String name() {
        return "html_escape";
    }

    @Override
    public String apply(String text, RenderContext context) {
        return HtmlUtils.htmlEscape(text, "UTF-8");
    }
}
