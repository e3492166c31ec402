package com.mealscout.images;

import com.mealscout.config.AiProperties;
import com.mealscout.integrations.HttpCallPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;

/**
 * Downloads an image and re-encodes it as an RGB JPEG, whatever format it came in.
 */
@Component
@Slf4j
public class ImageDownloader {

    private final WebClient webClient;
    private final HttpCallPolicy policy;

    public ImageDownloader(@Qualifier("imageWebClient") WebClient webClient, AiProperties properties) {
        this.webClient = webClient;
        this.policy = new HttpCallPolicy("Image download", properties.getVision().getDownloadTimeoutMs(), 0, 0);
    }

    public byte[] downloadAsJpeg(String url) {
        byte[] raw = policy.await(webClient.get()
                .uri(URI.create(url))
                .retrieve()
                .bodyToMono(byte[].class));
        if (raw == null || raw.length == 0) {
            throw new IllegalStateException("Empty image body");
        }
        log.debug("Downloaded image bytes={}", raw.length);
        return toJpeg(raw);
    }

    static byte[] toJpeg(byte[] raw) {
        try {
            BufferedImage source = ImageIO.read(new ByteArrayInputStream(raw));
            if (source == null) {
                throw new IllegalArgumentException("Unsupported image format");
            }
            BufferedImage rgb = new BufferedImage(source.getWidth(), source.getHeight(), BufferedImage.TYPE_INT_RGB);
            Graphics2D graphics = rgb.createGraphics();
            try {
                graphics.drawImage(source, 0, 0, Color.WHITE, null);
            } finally {
                graphics.dispose();
            }
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            if (!ImageIO.write(rgb, "jpg", out)) {
                throw new IllegalStateException("No JPEG writer available");
            }
            return out.toByteArray();
        } catch (IOException e) {
            throw new UncheckedIOException("Could not decode image", e);
        }
    }
}
