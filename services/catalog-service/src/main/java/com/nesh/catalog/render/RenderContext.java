package com.nesh.catalog.render;

import com.nesh.catalog.model.AnchorIds;
import com.nesh.catalog.model.Position;
import com.nesh.catalog.query.CodeFormats;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Per-render state: the chapter's notes and positions plus what the rules have emitted so far.
 */
public class RenderContext {
    private final String chapter;
    private final Map<String, String> notes;
    private final Map<String, String> anchorsByDigits = new HashMap<>();
    private final Set<String> emittedAnchors = new HashSet<>();
    private final Set<String> referencedNotes = new LinkedHashSet<>();

    public RenderContext(String chapter, Map<String, String> notes, List<Position> positions) {
        this.chapter = chapter;
        this.notes = notes == null ? Map.of() : notes;
        if (positions != null) {
            for (Position position : positions) {
                anchorsByDigits.putIfAbsent(CodeFormats.clean(position.code()), position.anchor());
            }
        }
    }

    public String getChapter() {
        return chapter;
    }

    public boolean hasNote(String number) {
        return notes.containsKey(number);
    }

    public String anchorFor(String code) {
        String anchor = anchorsByDigits.get(CodeFormats.clean(code));
        return anchor != null ? anchor : AnchorIds.forCode(code);
    }

    /**
     * Returns true the first time an anchor is claimed in this render.
     */
    public boolean claimAnchor(String anchor) {
        return emittedAnchors.add(anchor);
    }

    public void markNoteReferenced(String number) {
        referencedNotes.add(number);
    }

    public Set<String> getReferencedNotes() {
        return referencedNotes;
    }
}
