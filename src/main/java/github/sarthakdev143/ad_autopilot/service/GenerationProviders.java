package github.sarthakdev143.ad_autopilot.service;

import java.util.Objects;

/**
 * The three job clients a chain can talk to: still images, image-to-video, and template renders.
 */
public record GenerationProviders(ExternalJobClient image, ExternalJobClient video, ExternalJobClient render) {

    public GenerationProviders {
        Objects.requireNonNull(image, "image client is required");
        Objects.requireNonNull(video, "video client is required");
        Objects.requireNonNull(render, "render client is required");
    }

    public ExternalJobClient videoClientFor(String providerName) {
        if (render.providerName().equals(providerName)) {
            return render;
        }
        return video;
    }
}
