package eu.okaeri.docstore.mongo.filter;

import eu.okaeri.docstore.filter.Update;
import org.bson.BsonDocument;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static eu.okaeri.docstore.mongo.BsonTestSupport.bson;
import static org.assertj.core.api.Assertions.assertThat;

class MongoUpdateRendererTest {

    private final MongoUpdateRenderer renderer = new MongoUpdateRenderer();

    @Test
    void single_field_renders_set() {
        assertThat(bson(this.renderer.render(Update.set("published", false))))
            .isEqualTo(BsonDocument.parse("{\"$set\": {\"published\": false}}"));
    }

    @Test
    void multiple_fields_render_one_set() {
        Update update = Update.set("name", "Japan").and("featured", true);

        assertThat(bson(this.renderer.render(update)))
            .isEqualTo(BsonDocument.parse("{\"$set\": {\"name\": \"Japan\", \"featured\": true}}"));
    }

    @Test
    void list_values_are_replaced_whole() {
        Update update = Update.set("embassies", Arrays.asList("Tokyo", "Osaka"));

        assertThat(bson(this.renderer.render(update)))
            .isEqualTo(BsonDocument.parse("{\"$set\": {\"embassies\": [\"Tokyo\", \"Osaka\"]}}"));
    }

    @Test
    void null_value_is_set_explicitly() {
        assertThat(bson(this.renderer.render(Update.set("hero_image_url", null))))
            .isEqualTo(BsonDocument.parse("{\"$set\": {\"hero_image_url\": null}}"));
    }
}
