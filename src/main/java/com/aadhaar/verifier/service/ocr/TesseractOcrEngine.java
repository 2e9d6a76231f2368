package com.aadhaar.verifier.service.ocr;

import com.aadhaar.verifier.config.VerificationProperties;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import javax.imageio.ImageIO;
import net.sourceforge.tess4j.ITessAPI;
import net.sourceforge.tess4j.ITesseract;
import net.sourceforge.tess4j.Tesseract;
import net.sourceforge.tess4j.TesseractException;
import net.sourceforge.tess4j.Word;
import net.sourceforge.tess4j.util.LoadLibs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Reads the text of a document image with Tesseract. The image is recognized once per configured
 * page segmentation mode and the non-blank outputs are joined line by line, which gives the field
 * extractors several readings of the same card to search.
 */
@Component
public class TesseractOcrEngine {

    private static final Logger log = LoggerFactory.getLogger(TesseractOcrEngine.class);

    private final ITesseract tesseract;
    private final List<Integer> pageSegModes;

    @Autowired
    public TesseractOcrEngine(VerificationProperties properties) {
        this(create(properties.ocr()), properties.ocr().pageSegModes());
    }

    TesseractOcrEngine(ITesseract tesseract, List<Integer> pageSegModes) {
        this.tesseract = Objects.requireNonNull(tesseract, "tesseract");
        this.pageSegModes = List.copyOf(pageSegModes);
    }

    private static ITesseract create(VerificationProperties.Ocr ocr) {
        Tesseract instance = new Tesseract();
        Path tessData = resolveTessData(ocr);
        instance.setDatapath(tessData.toAbsolutePath().toString());
        instance.setLanguage(ocr.language());
        instance.setVariable("user_defined_dpi", "300");
        if (ocr.whitelist() != null && !ocr.whitelist().isBlank()) {
            instance.setVariable("tessedit_char_whitelist", ocr.whitelist());
        }
        log.info("Tesseract configured with language {} and data path {}", ocr.language(), tessData);
        return instance;
    }

    private static Path resolveTessData(VerificationProperties.Ocr ocr) {
        List<String> candidates = new ArrayList<>();
        if (ocr.datapath() != null && !ocr.datapath().isBlank()) {
            candidates.add(ocr.datapath().trim());
        }
        String environment = System.getenv("TESSDATA_PREFIX");
        if (environment != null && !environment.isBlank()) {
            candidates.add(environment.trim());
        }
        for (String candidate : candidates) {
            try {
                Path path = Path.of(candidate);
                if (Files.isRegularFile(path.resolve(ocr.language() + ".traineddata"))) {
                    return path;
                }
                Path nested = path.resolve("tessdata");
                if (Files.isRegularFile(nested.resolve(ocr.language() + ".traineddata"))) {
                    return nested;
                }
                log.warn("Tesseract data path {} has no {}.traineddata", candidate, ocr.language());
            } catch (InvalidPathException ex) {
                log.warn("Tesseract data path {} is invalid: {}", candidate, ex.getMessage());
            }
        }
        return LoadLibs.extractTessResources("tessdata").toPath();
    }

    /**
     * @param imageBytes encoded image (PNG, JPEG, ...)
     * @return the joined text of all passes, empty if no pass produced text
     * @throws IllegalArgumentException if the bytes are empty or not a readable image
     */
    public Optional<OcrResult> recognize(byte[] imageBytes) {
        if (imageBytes == null || imageBytes.length == 0) {
            throw new IllegalArgumentException("Document image must not be empty");
        }
        BufferedImage image;
        try {
            image = ImageIO.read(new ByteArrayInputStream(imageBytes));
        } catch (IOException ex) {
            throw new IllegalStateException("Unable to decode document image", ex);
        }
        if (image == null) {
            throw new IllegalArgumentException("Unsupported image format");
        }
        return recognize(image);
    }

    public Optional<OcrResult> recognize(BufferedImage image) {
        List<String> texts = new ArrayList<>();
        double confidence;
        synchronized (tesseract) {
            for (Integer mode : pageSegModes) {
                tesseract.setPageSegMode(mode);
                try {
                    String text = tesseract.doOCR(image);
                    if (text != null && !text.isBlank()) {
                        texts.add(text.strip());
                    }
                } catch (TesseractException ex) {
                    log.warn("Tesseract pass with page segmentation mode {} failed: {}", mode, ex.getMessage());
                }
            }
            confidence = texts.isEmpty() ? 0.0 : readConfidence(image);
        }
        if (texts.isEmpty()) {
            log.debug("No text recognized in {} passes", pageSegModes.size());
            return Optional.empty();
        }
        log.debug("Recognized {} text passes with confidence {}", texts.size(), confidence);
        return Optional.of(new OcrResult(String.join("\n", texts), confidence));
    }

    /**
     * Mean confidence of the recognized words scaled to [0,1]. Words Tesseract could not score
     * (negative confidence) are left out; 0 when nothing is left.
     */
    private double readConfidence(BufferedImage image) {
        List<Word> words;
        try {
            words = tesseract.getWords(image, ITessAPI.TessPageIteratorLevel.RIL_WORD);
        } catch (RuntimeException ex) {
            log.debug("Word confidences unavailable: {}", ex.getMessage());
            return 0.0;
        }
        if (words == null) {
            return 0.0;
        }
        double mean = words.stream()
                .mapToDouble(Word::getConfidence)
                .filter(value -> value >= 0 && Double.isFinite(value))
                .average()
                .orElse(0.0);
        return Math.min(1.0, mean / 100.0);
    }

    public record OcrResult(String text, double confidence) {
    }
}
