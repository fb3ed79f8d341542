package com.phillippitts.adaptiveencoder.service.profile;

import com.phillippitts.adaptiveencoder.domain.ContentType;
import com.phillippitts.adaptiveencoder.domain.EncoderParams;
import com.phillippitts.adaptiveencoder.domain.EncodingProfile;
import com.phillippitts.adaptiveencoder.exception.UnknownProfileException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * {@link ProfileStore} loaded once from the {@code profiles.json} classpath resource.
 *
 * <p>Format:
 * <pre>
 * {"profiles": {"film": {"title": "...", "preset": "slow", "crf": 19, "pixelFormat": "yuv420p10le",
 *   "codecProfile": "main10", "baseBitrate": 4500, "hdrBitrate": 5500, "contentType": "film",
 *   "encoderParams": "aq-mode=3:no-sao"}}}
 * </pre>
 */
@Component
public class JsonProfileStore implements ProfileStore {

    private static final Logger LOG = LogManager.getLogger(JsonProfileStore.class);

    static final String DEFAULT_RESOURCE = "/profiles.json";

    private final Map<String, EncodingProfile> profiles;

    public JsonProfileStore() {
        this(DEFAULT_RESOURCE);
    }

    JsonProfileStore(String resource) {
        this.profiles = load(resource);
        LOG.info("Loaded {} encoding profiles from {}", profiles.size(), resource);
    }

    @Override
    public Optional<EncodingProfile> find(String name) {
        return Optional.ofNullable(name == null ? null : profiles.get(name));
    }

    @Override
    public EncodingProfile get(String name) {
        return find(name).orElseThrow(() -> new UnknownProfileException(name));
    }

    @Override
    public List<EncodingProfile> listProfiles() {
        return List.copyOf(profiles.values());
    }

    /**
     * Parses the catalog document. Package-private for tests.
     */
    static Map<String, EncodingProfile> parse(String json) {
        JSONObject root = new JSONObject(json);
        JSONObject defs = root.getJSONObject("profiles");
        Map<String, EncodingProfile> out = new TreeMap<>();
        for (String name : defs.keySet()) {
            JSONObject p = defs.getJSONObject(name);
            String typeLabel = p.optString("contentType", "film");
            ContentType type = ContentType.fromLabel(typeLabel)
                    .orElseThrow(() -> new IllegalStateException(
                            "Profile " + name + " has unknown content type: " + typeLabel));
            out.put(name, new EncodingProfile(
                    name,
                    p.optString("title", name),
                    p.getString("preset"),
                    p.getDouble("crf"),
                    p.getString("pixelFormat"),
                    p.getString("codecProfile"),
                    p.getInt("baseBitrate"),
                    p.getInt("hdrBitrate"),
                    EncoderParams.parse(p.optString("encoderParams", "")),
                    type));
        }
        return out;
    }

    private static Map<String, EncodingProfile> load(String resource) {
        try (InputStream in = JsonProfileStore.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Profile catalog not found on classpath: " + resource);
            }
            return parse(new String(in.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read profile catalog " + resource, e);
        } catch (JSONException e) {
            throw new IllegalStateException("Malformed profile catalog " + resource + ": " + e.getMessage(), e);
        }
    }
}
