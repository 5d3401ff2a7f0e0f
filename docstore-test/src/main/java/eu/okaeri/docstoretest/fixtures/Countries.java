package eu.okaeri.docstoretest.fixtures;

import eu.okaeri.docstore.collection.CollectionIndex;
import eu.okaeri.docstore.collection.DocumentCollection;
import eu.okaeri.docstore.document.Document;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Country guide fixtures shared by the end-to-end suite.
 */
public final class Countries {

    public static final String COLLECTION_NAME = "countries";

    public static final DocumentCollection COLLECTION = DocumentCollection.of(COLLECTION_NAME)
        .sequenceFields("embassies", "important_notes")
        .index(CollectionIndex.unique("slug"))
        .index(CollectionIndex.of("region"));

    private Countries() {
    }

    public static Document country(String slug, String name, String region, boolean published, String summary) {
        return new Document()
            .append("slug", slug)
            .append("name", name)
            .append("region", region)
            .append("published", published)
            .append("featured", false)
            .append("summary", summary);
    }

    /**
     * Seven countries over four regions, five of them published.
     */
    public static List<Document> all() {
        return Arrays.asList(
            country("japan", "Japan", "Asia", true, "Island nation with visa-free short stays")
                .append("featured", true)
                .append("embassies", Arrays.asList(
                    new Document().append("city", "Warsaw").append("phone", "+48 22 696 50 00"))),
            country("france", "France", "Europe", true, "Schengen member, no visa for EU citizens"),
            country("poland", "Poland", "Europe", true, "Schengen member with biometric passports")
                .append("important_notes", Collections.singletonList("Carry your ID at all times")),
            country("brazil", "Brazil", "South America", false, "Visa on arrival for some nationalities"),
            country("kenya", "Kenya", "Africa", true, "Electronic travel authorisation required"),
            country("thailand", "Thailand", "Asia", true, "Visa exemption for tourist stays"),
            country("finland", "Finland", "Europe", false, "Lakes, saunas and Schengen rules")
        );
    }

    public static long publishedCount() {
        return all().stream().filter(country -> Boolean.TRUE.equals(country.get("published"))).count();
    }
}
