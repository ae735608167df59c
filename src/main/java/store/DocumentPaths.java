package store;

import java.util.ArrayList;
import java.util.List;
import lombok.NonNull;
import lombok.experimental.UtilityClass;

@UtilityClass
public class DocumentPaths {

    public String join(@NonNull String... segments) {
        var parts = new ArrayList<String>();
        for (String segment : segments) {
            parts.addAll(split(segment));
        }
        return String.join("/", parts);
    }

    /** Splits a path into non-empty segments; rejects an empty path. */
    public List<String> split(@NonNull String path) {
        var parts = new ArrayList<String>();
        for (String part : path.split("/")) {
            if (!part.isBlank()) {
                parts.add(part);
            }
        }
        if (parts.isEmpty()) {
            throw new IllegalArgumentException("Empty document path: '" + path + "'");
        }
        return parts;
    }

    /** True if one path equals the other or lies underneath it. */
    public boolean overlaps(List<String> a, List<String> b) {
        int common = Math.min(a.size(), b.size());
        return a.subList(0, common).equals(b.subList(0, common));
    }
}
