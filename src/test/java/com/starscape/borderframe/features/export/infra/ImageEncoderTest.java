package com.starscape.borderframe.features.export.infra;

import com.starscape.borderframe.features.composite.infra.ColorProfileReader;
import com.starscape.borderframe.features.export.domain.FormatPolicy;
import com.starscape.borderframe.features.export.domain.SaveFormat;
import com.starscape.borderframe.features.export.domain.SaveParameters;
import com.starscape.borderframe.features.metadata.app.MetadataPreserver;
import com.starscape.borderframe.support.ImageFixtures;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.w3c.dom.NodeList;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.metadata.IIOMetadata;
import javax.imageio.metadata.IIOMetadataNode;
import javax.imageio.plugins.tiff.TIFFDirectory;
import javax.imageio.plugins.tiff.TIFFField;
import javax.imageio.stream.ImageInputStream;
import java.awt.color.ColorSpace;
import java.awt.color.ICC_Profile;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeFalse;

class ImageEncoderTest {

    @TempDir
    Path tempDir;

    private final ImageEncoder imageEncoder = new ImageEncoder(new MetadataPreserver());
    private final ColorProfileReader colorProfileReader = new ColorProfileReader();

    @Test
    void shouldWriteJpegWithoutChromaSubsampling() throws Exception {
        byte[] jpeg = imageEncoder.encode(ImageFixtures.gradient(40, 30), FormatPolicy.parametersFor(SaveFormat.JPEG, 90));

        IIOMetadata metadata = readMetadata(jpeg, "jpeg");
        IIOMetadataNode root = (IIOMetadataNode) metadata.getAsTree("javax_imageio_jpeg_image_1.0");
        NodeList components = root.getElementsByTagName("componentSpec");
        assertEquals(3, components.getLength());
        for (int i = 0; i < components.getLength(); i++) {
            IIOMetadataNode component = (IIOMetadataNode) components.item(i);
            assertEquals("1", component.getAttribute("HsamplingFactor"));
            assertEquals("1", component.getAttribute("VsamplingFactor"));
        }
    }

    @Test
    void shouldWritePngLosslessly() throws Exception {
        BufferedImage image = ImageFixtures.gradient(33, 17);

        byte[] png = imageEncoder.encode(image, FormatPolicy.parametersFor(SaveFormat.PNG, null));

        assertSamePixels(image, ImageIO.read(new ByteArrayInputStream(png)));
    }

    @Test
    void shouldWriteTiffLosslessly() throws Exception {
        BufferedImage image = ImageFixtures.gradient(21, 13);

        byte[] tiff = imageEncoder.encode(image, FormatPolicy.parametersFor(SaveFormat.TIFF, null));

        assertSamePixels(image, ImageIO.read(new ByteArrayInputStream(tiff)));
    }

    @Test
    void shouldCarryIccProfileIntoTiffByteForByte() throws Exception {
        byte[] profile = ICC_Profile.getInstance(ColorSpace.CS_LINEAR_RGB).getData();

        byte[] tiff = imageEncoder.encode(ImageFixtures.gradient(21, 13),
            FormatPolicy.parametersFor(SaveFormat.TIFF, null).withIccProfile(profile));

        TIFFDirectory directory = TIFFDirectory.createFromMetadata(readMetadata(tiff, "tiff"));
        TIFFField iccField = directory.getTIFFField(34675);
        assertNotNull(iccField);
        assertArrayEquals(profile, iccField.getAsBytes());
    }

    @Test
    void shouldCarryIccProfileIntoJpegByteForByte() throws Exception {
        byte[] profile = ICC_Profile.getInstance(ColorSpace.CS_LINEAR_RGB).getData();
        SaveParameters parameters = FormatPolicy.parametersFor(SaveFormat.JPEG, 95).withIccProfile(profile);

        Path output = tempDir.resolve("out.jpg");
        Files.write(output, imageEncoder.encode(ImageFixtures.gradient(16, 16), parameters));

        Optional<byte[]> copied = colorProfileReader.read(output);
        assertTrue(copied.isPresent());
        assertArrayEquals(profile, copied.get());
    }

    @Test
    void shouldCarryIccProfileIntoPngByteForByte() throws Exception {
        byte[] profile = ICC_Profile.getInstance(ColorSpace.CS_LINEAR_RGB).getData();
        SaveParameters parameters = FormatPolicy.parametersFor(SaveFormat.PNG, null).withIccProfile(profile);

        Path output = tempDir.resolve("out.png");
        Files.write(output, imageEncoder.encode(ImageFixtures.gradient(16, 16), parameters));

        Optional<byte[]> copied = colorProfileReader.read(output);
        assertTrue(copied.isPresent());
        assertArrayEquals(profile, copied.get());
    }

    @Test
    void shouldSplitLargeProfilesAcrossSegments() throws Exception {
        byte[] profile = new byte[JpegIccSegments.MAX_CHUNK * 2 + 100];
        for (int i = 0; i < profile.length; i++) {
            profile[i] = (byte) (i * 31);
        }
        byte[] jpeg = ImageFixtures.encode(ImageFixtures.gradient(8, 8), "jpg");

        Path output = tempDir.resolve("big-profile.jpg");
        Files.write(output, JpegIccSegments.insert(jpeg, profile));

        assertArrayEquals(profile, colorProfileReader.read(output).orElseThrow());
    }

    @Test
    void shouldRejectNonJpegWhenInsertingProfile() {
        assertThrows(IOException.class, () -> JpegIccSegments.insert(new byte[]{1, 2, 3, 4}, new byte[]{1}));
    }

    @Test
    void shouldFailWhenNoHeifWriterIsInstalled() {
        assumeFalse(ImageIO.getImageWritersByFormatName("heif").hasNext()
            || ImageIO.getImageWritersByFormatName("heic").hasNext());

        IOException error = assertThrows(IOException.class, () ->
            imageEncoder.encode(ImageFixtures.gradient(8, 8), FormatPolicy.parametersFor(SaveFormat.HEIF, 80)));
        assertTrue(error.getMessage().contains("HEIF"));
    }

    private static IIOMetadata readMetadata(byte[] data, String format) throws IOException {
        Iterator<ImageReader> readers = ImageIO.getImageReadersByFormatName(format);
        ImageReader reader = readers.next();
        try (ImageInputStream in = ImageIO.createImageInputStream(new ByteArrayInputStream(data))) {
            reader.setInput(in);
            return reader.getImageMetadata(0);
        } finally {
            reader.dispose();
        }
    }

    private static void assertSamePixels(BufferedImage expected, BufferedImage actual) {
        assertNotNull(actual);
        assertEquals(expected.getWidth(), actual.getWidth());
        assertEquals(expected.getHeight(), actual.getHeight());
        for (int y = 0; y < expected.getHeight(); y++) {
            for (int x = 0; x < expected.getWidth(); x++) {
                assertEquals(expected.getRGB(x, y), actual.getRGB(x, y), "pixel " + x + "," + y);
            }
        }
    }
}
