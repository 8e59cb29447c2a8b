package com.carrental.service;

import org.springframework.stereotype.Service;

import javax.imageio.ImageIO;
import java.awt.*;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.security.SecureRandom;
import java.util.Locale;

@Service
public class CaptchaService {

    public static final String SESSION_KEY = "CAPTCHA_CODE";

    static final String ALPHABET = "ABCDEFGHJKLMNPQRSTUVWXYZ23456789"; // no 0/O, 1/I
    static final int CODE_LENGTH = 5;
    static final int WIDTH = 150;
    static final int HEIGHT = 50;

    private final SecureRandom random = new SecureRandom();

    public String generateCode() {
        StringBuilder sb = new StringBuilder(CODE_LENGTH);
        for (int i = 0; i < CODE_LENGTH; i++) {
            sb.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return sb.toString();
    }

    /** Renders the code as a PNG with noise lines and dots. */
    public byte[] renderPng(String code) throws IOException {
        BufferedImage image = new BufferedImage(WIDTH, HEIGHT, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = image.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
            g.setColor(Color.WHITE);
            g.fillRect(0, 0, WIDTH, HEIGHT);

            for (int i = 0; i < 8; i++) {
                g.setColor(randomColor(150, 220));
                g.drawLine(random.nextInt(WIDTH), random.nextInt(HEIGHT), random.nextInt(WIDTH), random.nextInt(HEIGHT));
            }

            g.setFont(new Font(Font.SANS_SERIF, Font.BOLD, 28));
            int x = 12;
            for (char c : code.toCharArray()) {
                g.setColor(randomColor(20, 120));
                double angle = Math.toRadians(random.nextInt(31) - 15);
                int y = 34 + random.nextInt(6);
                g.rotate(angle, x, y);
                g.drawString(String.valueOf(c), x, y);
                g.rotate(-angle, x, y);
                x += 26;
            }

            for (int i = 0; i < 60; i++) {
                image.setRGB(random.nextInt(WIDTH), random.nextInt(HEIGHT), randomColor(0, 255).getRGB());
            }
        } finally {
            g.dispose();
        }

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ImageIO.write(image, "png", out);
        return out.toByteArray();
    }

    /** Case-insensitive comparison of the user's answer with the expected code; surrounding spaces are ignored. */
    public boolean validate(String input, String expected) {
        if (input == null || expected == null) return false;
        return input.trim().toUpperCase(Locale.ROOT).equals(expected.trim().toUpperCase(Locale.ROOT));
    }

    private Color randomColor(int min, int max) {
        int span = max - min;
        return new Color(min + random.nextInt(span + 1), min + random.nextInt(span + 1), min + random.nextInt(span + 1));
    }
}
