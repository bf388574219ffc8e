package dev.sfc.engine;

import dev.sfc.xml.Elements;
import org.w3c.dom.Element;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Program tags keyed by exact name, read from a {@code Tags} element.
 */
public final class TagDictionary {

    private final Map<String, Element> tags;

    private TagDictionary(Map<String, Element> tags) {
        this.tags = Collections.unmodifiableMap(tags);
    }

    public static TagDictionary empty() {
        return new TagDictionary(Map.of());
    }

    /**
     * Index the {@code Tag} children of {@code tagsElement}. Tags without a
     * name are ignored; a repeated name keeps the last tag.
     */
    public static TagDictionary fromElement(Element tagsElement) {
        var tags = new LinkedHashMap<String, Element>();
        for (Element tag : Elements.children(tagsElement, "Tag")) {
            String name = Elements.attribute(tag, "Name");
            if (name != null) {
                tags.put(name, tag);
            }
        }
        return new TagDictionary(tags);
    }

    public boolean contains(String tagName) {
        return tagName != null && tags.containsKey(tagName);
    }

    public Set<String> names() {
        return tags.keySet();
    }

    /**
     * {@code Value} of the first element nested in the tag whose {@code Name}
     * is {@code memberName}, e.g. the {@code PRE} member of a timer structure.
     */
    public Optional<String> memberValue(String tagName, String memberName) {
        if (tagName == null) {
            return Optional.empty();
        }
        Element member = Elements.findDescendant(tags.get(tagName), "Name", memberName);
        return Optional.ofNullable(Elements.attribute(member, "Value"));
    }
}
