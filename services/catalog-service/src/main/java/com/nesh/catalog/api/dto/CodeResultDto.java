package com.nesh.catalog.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;

public class CodeResultDto {
    private String token;
    private boolean found;
    private String chapter;

    @JsonProperty("chapter_title")
    private String chapterTitle;

    @JsonProperty("target_code")
    private String targetCode;

    @JsonProperty("matched_anchor")
    private String matchedAnchor;

    private List<PositionDto> positions;
    private Map<String, String> notes;
    private String html;

    @JsonProperty("referenced_notes")
    private List<String> referencedNotes;

    private SectionsDto sections;

    @JsonProperty("tariff_matches")
    private List<TariffNodeDto> tariffMatches;

    private List<TariffNodeDto> ancestors;
    private List<TariffNodeDto> siblings;
    private String error;

    public String getToken() {
        return token;
    }

    public void setToken(String token) {
        this.token = token;
    }

    public boolean isFound() {
        return found;
    }

    public void setFound(boolean found) {
        this.found = found;
    }

    public String getChapter() {
        return chapter;
    }

    public void setChapter(String chapter) {
        this.chapter = chapter;
    }

    public String getChapterTitle() {
        return chapterTitle;
    }

    public void setChapterTitle(String chapterTitle) {
        this.chapterTitle = chapterTitle;
    }

    public String getTargetCode() {
        return targetCode;
    }

    public void setTargetCode(String targetCode) {
        this.targetCode = targetCode;
    }

    public String getMatchedAnchor() {
        return matchedAnchor;
    }

    public void setMatchedAnchor(String matchedAnchor) {
        this.matchedAnchor = matchedAnchor;
    }

    public List<PositionDto> getPositions() {
        return positions;
    }

    public void setPositions(List<PositionDto> positions) {
        this.positions = positions;
    }

    public Map<String, String> getNotes() {
        return notes;
    }

    public void setNotes(Map<String, String> notes) {
        this.notes = notes;
    }

    public String getHtml() {
        return html;
    }

    public void setHtml(String html) {
        this.html = html;
    }

    public List<String> getReferencedNotes() {
        return referencedNotes;
    }

    public void setReferencedNotes(List<String> referencedNotes) {
        this.referencedNotes = referencedNotes;
    }

    public SectionsDto getSections() {
        return sections;
    }

    public void setSections(SectionsDto sections) {
        this.sections = sections;
    }

    public List<TariffNodeDto> getTariffMatches() {
        return tariffMatches;
    }

    public void setTariffMatches(List<TariffNodeDto> tariffMatches) {
        this.tariffMatches = tariffMatches;
    }

    public List<TariffNodeDto> getAncestors() {
        return ancestors;
    }

    public void setAncestors(List<TariffNodeDto> ancestors) {
        this.ancestors = ancestors;
    }

    public List<TariffNodeDto> getSiblings() {
        return siblings;
    }

    public void setSiblings(List<TariffNodeDto> siblings) {
        this.siblings = siblings;
    }

    public String getError() {
        return error;
    }

    public void setError(String error) {
        this.error = error;
    }
}
