package com.starscape.borderframe.features.batch.app;

import com.drew.imaging.ImageMetadataReader;
import com.drew.metadata.Metadata;
import com.drew.metadata.exif.ExifIFD0Directory;
import com.drew.metadata.exif.GpsDirectory;
import com.starscape.borderframe.features.batch.domain.CancellationToken;
import com.starscape.borderframe.features.batch.domain.Job;
import com.starscape.borderframe.features.batch.domain.JobResult;
import com.starscape.borderframe.features.batch.domain.JobStatus;
import com.starscape.borderframe.features.batch.domain.Settings;
import com.starscape.borderframe.features.composite.app.Compositor;
import com.starscape.borderframe.features.composite.domain.BorderColor;
import com.starscape.borderframe.features.composite.infra.ColorProfileReader;
import com.starscape.borderframe.features.export.domain.FormatPolicy;
import com.starscape.borderframe.features.export.domain.SaveFormat;
import com.starscape.borderframe.features.export.infra.ImageEncoder;
import com.starscape.borderframe.features.metadata.app.MetadataPreserver;
import com.starscape.borderframe.features.planframe.domain.AspectRatio;
import com.starscape.borderframe.features.planframe.domain.BorderMode;
import com.starscape.borderframe.support.ImageFixtures;
import org.apache.commons.codec.digest.DigestUtils;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.ImageIO;
import java.awt.*;
import java.awt.color.ColorSpace;
import java.awt.color.ICC_Profile;
import java.awt.image.BufferedImage;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static com.starscape.borderframe.support.ImageFixtures.rgb;
import static org.junit.jupiter.api.Assertions.*;

class ImageJobProcessorTest {

    @TempDir
    Path tempDir;

    private final MetadataPreserver metadataPreserver = new MetadataPreserver();
    private final ImageEncoder imageEncoder = new ImageEncoder(metadataPreserver);
    private final ColorProfileReader colorProfileReader = new ColorProfileReader();
    private final ImageJobProcessor processor = new ImageJobProcessor(
        new Compositor(), colorProfileReader, metadataPreserver, imageEncoder);

    @Test
    void shouldKeepGpsInJpegOutput() throws Exception {
        Path source = ImageFixtures.writeJpegWithGps(tempDir, "geo.jpg", -122.4194, 37.7749);
        Settings settings = Settings.of("walk", null, 5, SaveFormat.JPEG, 95, true, BorderColor.WHITE);

        JobResult result = processor.process(new Job(source, 0, 1), settings, tempDir, new CancellationToken());

        assertEquals(JobStatus.COMPLETED, result.status());
        assertEquals(tempDir.resolve("walk.jpg"), result.outputPath());
        byte[] written = Files.readAllBytes(result.outputPath());
        assertEquals(DigestUtils.sha256Hex(written), result.checksum());

        Metadata metadata = ImageMetadataReader.readMetadata(result.outputPath().toFile());
        GpsDirectory gps = metadata.getFirstDirectoryOfType(GpsDirectory.class);
        assertNotNull(gps);
        assertEquals(37.7749, gps.getGeoLocation().getLatitude(), 1e-4);
        ExifIFD0Directory root = metadata.getFirstDirectoryOfType(ExifIFD0Directory.class);
        assertTrue(root == null || !root.containsTag(ExifIFD0Directory.TAG_MAKE));
    }

    @Test
    void shouldDropMetadataWhenNotRequested() throws Exception {
        Path source = ImageFixtures.writeJpegWithGps(tempDir, "geo.jpg", 2.35, 48.85);
        Settings settings = Settings.of(null, null, 0, SaveFormat.JPEG, 80, false, BorderColor.WHITE);

        JobResult result = processor.process(new Job(source, 0, 1), settings, tempDir, new CancellationToken());

        assertTrue(result.isSuccess());
        Metadata metadata = ImageMetadataReader.readMetadata(result.outputPath().toFile());
        assertNull(metadata.getFirstDirectoryOfType(GpsDirectory.class));
    }

    @Test
    void shouldFrameTransparentPngOnProportionalBorder() throws Exception {
        BufferedImage image = new BufferedImage(200, 100, BufferedImage.TYPE_INT_ARGB);
        Graphics2D g = image.createGraphics();
        g.setColor(Color.BLUE);
        g.fillRect(50, 0, 100, 100);
        g.dispose();
        Path source = ImageFixtures.writePng(tempDir, "logo.png", image);
        Settings settings = new Settings(null, AspectRatio.SQUARE, 50, BorderMode.PROPORTIONAL,
            SaveFormat.PNG, null, false, new BorderColor(255, 0, 0));

        JobResult result = processor.process(new Job(source, 0, 2), settings, tempDir, new CancellationToken());

        assertTrue(result.isSuccess());
        assertEquals("logo_processed.png", result.outputPath().getFileName().toString());
        BufferedImage written = ImageIO.read(result.outputPath().toFile());
        // border 50 * 100 / 1000 = 5, canvas 210x210
        assertEquals(210, written.getWidth());
        assertEquals(210, written.getHeight());
        assertEquals(0xFF0000, rgb(written, 0, 0));
        assertEquals(0xFF0000, rgb(written, 10, 105));
        assertEquals(0x0000FF, rgb(written, 105, 105));
    }

    @Test
    void shouldSkipWorkOnceCancelled() throws Exception {
        Path source = ImageFixtures.writeJpeg(tempDir, "a.jpg", 10, 10);
        CancellationToken cancellation = new CancellationToken();
        cancellation.cancel();
        Settings settings = Settings.of(null, null, 0, SaveFormat.PNG, null, false, BorderColor.WHITE);

        JobResult result = processor.process(new Job(source, 0, 1), settings, tempDir, cancellation);

        assertEquals(JobStatus.CANCELLED, result.status());
        assertFalse(Files.exists(tempDir.resolve("a_processed.png")));
    }

    @Test
    void shouldNameSourceInFailureMessage() {
        Settings settings = Settings.of(null, null, 0, SaveFormat.PNG, null, false, BorderColor.WHITE);

        JobResult result = processor.process(
            new Job(tempDir.resolve("missing.png"), 0, 1), settings, tempDir, new CancellationToken());

        assertTrue(result.isFailure());
        assertTrue(result.errorMessage().startsWith("Error processing missing.png: "), result.errorMessage());
    }

    @Test
    void shouldCopyTiffSourceProfileByteForByte() throws Exception {
        byte[] profile = ICC_Profile.getInstance(ColorSpace.CS_LINEAR_RGB).getData();
        // Creator field; the JDK would write its own value back if it re-serialised the profile
        profile[80] = 'B';
        profile[81] = 'F';
        profile[82] = 'R';
        profile[83] = 'M';
        Path source = tempDir.resolve("scan.tif");
        Files.write(source, imageEncoder.encode(ImageFixtures.gradient(24, 16),
            FormatPolicy.parametersFor(SaveFormat.TIFF, null).withIccProfile(profile)));
        Path outputDir = Files.createDirectory(tempDir.resolve("out"));
        Settings settings = Settings.of(null, null, 3, SaveFormat.TIFF, null, false, BorderColor.WHITE);

        JobResult result = processor.process(new Job(source, 0, 1), settings, outputDir, new CancellationToken());

        assertTrue(result.isSuccess(), result.errorMessage());
        assertArrayEquals(profile, colorProfileReader.read(source).orElseThrow());
        Optional<byte[]> copied = colorProfileReader.read(result.outputPath());
        assertTrue(copied.isPresent());
        assertArrayEquals(profile, copied.get());
    }

    @Test
    void shouldWriteNoProfileWhenSourceHasNone() throws Exception {
        Path source = ImageFixtures.writeJpeg(tempDir, "plain.jpg", 12, 12);
        Settings settings = Settings.of(null, null, 2, SaveFormat.TIFF, null, false, BorderColor.WHITE);

        JobResult result = processor.process(new Job(source, 0, 1), settings, tempDir, new CancellationToken());

        assertTrue(result.isSuccess(), result.errorMessage());
        assertTrue(colorProfileReader.read(result.outputPath()).isEmpty());
    }
}
