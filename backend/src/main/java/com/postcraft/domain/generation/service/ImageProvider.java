package com.postcraft.domain.generation.service;

import com.postcraft.domain.generation.model.AspectRatio;
import com.postcraft.domain.generation.model.GeneratedImage;
import com.postcraft.domain.generation.model.ProviderRef;
import com.postcraft.domain.generation.model.ReferenceAsset;

/**
 * Image-generation backend bound to one {@link ProviderRef}.
 */
public interface ImageProvider {

    ProviderRef ref();

    /**
     * Render one image.
     *
     * @param prompt      fully composed image prompt
     * @param aspectRatio requested framing
     * @param reference   optional logo/reference image, nullable
     * @return location of the rendered image
     * @throws ProviderException classified provider failure
     */
    GeneratedImage generate(String prompt, AspectRatio aspectRatio, ReferenceAsset reference);
}
