package nl.bytesoflife.deltaschematic.model;

import nl.bytesoflife.deltaschematic.sexpr.SNode;

import java.util.Collections;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Drawing frame text. Empty fields are not written.
 */
public final class TitleBlock implements DocumentEntry {

    private String title = "";
    private String date = "";
    private String revision = "";
    private String company = "";
    private final SortedMap<Integer, String> comments = new TreeMap<>();
    private final SNode.SList raw;
    private boolean modified;

    public TitleBlock() {
        this(null);
    }

    public TitleBlock(SNode.SList raw) {
        this.raw = raw;
        this.modified = raw == null;
    }

    @Override
    public String tag() {
        return "title_block";
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title == null ? "" : title;
        modified = true;
    }

    public String getDate() {
        return date;
    }

    public void setDate(String date) {
        this.date = date == null ? "" : date;
        modified = true;
    }

    public String getRevision() {
        return revision;
    }

    public void setRevision(String revision) {
        this.revision = revision == null ? "" : revision;
        modified = true;
    }

    public String getCompany() {
        return company;
    }

    public void setCompany(String company) {
        this.company = company == null ? "" : company;
        modified = true;
    }

    public SortedMap<Integer, String> getComments() {
        return Collections.unmodifiableSortedMap(comments);
    }

    public void setComment(int number, String text) {
        if (number < 1 || number > 9) {
            throw new IllegalArgumentException("Comment number must be 1..9: " + number);
        }
        if (text == null || text.isEmpty()) {
            comments.remove(number);
        } else {
            comments.put(number, text);
        }
        modified = true;
    }

    public SNode.SList getRaw() {
        return raw;
    }

    public boolean isModified() {
        return modified;
    }

    public void clearModified() {
        modified = raw == null;
    }

    @Override
    public String toString() {
        return "TitleBlock{title=" + title + ", rev=" + revision + "}";
    }
}
