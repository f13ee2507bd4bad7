package github.sarthakdev143.style_reel.service;

import github.sarthakdev143.style_reel.exception.StyleGenerationException;
import github.sarthakdev143.style_reel.model.GeneratedImage;

public interface StyleImageGenerator {

    GeneratedImage generate(byte[] sourceImage, String contentType, String styleId, String prompt)
            throws StyleGenerationException;
}
