package com.starscape.borderframe.features.export.infra;

import com.starscape.borderframe.features.export.domain.SaveFormat;
import com.starscape.borderframe.features.export.domain.SaveParameters;
import com.starscape.borderframe.features.metadata.app.MetadataPreserver;
import com.starscape.borderframe.features.metadata.domain.GpsMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageTypeSpecifier;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.metadata.IIOMetadata;
import javax.imageio.metadata.IIOMetadataNode;
import javax.imageio.plugins.jpeg.JPEGImageWriteParam;
import javax.imageio.plugins.tiff.TIFFDirectory;
import javax.imageio.plugins.tiff.TIFFField;
import javax.imageio.plugins.tiff.TIFFTag;
import javax.imageio.stream.ImageOutputStream;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Iterator;
import java.util.Optional;
import java.util.zip.Deflater;
import java.util.zip.DeflaterOutputStream;

/**
 * Encodes a framed image according to its save parameters.
 * The source's ICC profile travels into JPEG, PNG and TIFF output byte for byte,
 * and JPEG output additionally carries the GPS-only EXIF block.
 */
@Component
public class ImageEncoder {

    private static final Logger log = LoggerFactory.getLogger(ImageEncoder.class);

    private static final String JPEG_NATIVE_FORMAT = "javax_imageio_jpeg_image_1.0";
    private static final String PNG_NATIVE_FORMAT = "javax_imageio_png_1.0";
    private static final int TIFF_TAG_ICC_PROFILE = 34675;

    private final MetadataPreserver metadataPreserver;

    public ImageEncoder(MetadataPreserver metadataPreserver) {
        this.metadataPreserver = metadataPreserver;
    }

    /**
     * Encode the image.
     *
     * @param image      opaque RGB image to write
     * @param parameters codec, quality and attachments
     * @return the encoded file contents
     * @throws IOException if no writer exists for the codec or encoding fails
     */
    public byte[] encode(BufferedImage image, SaveParameters parameters) throws IOException {
        SaveFormat format = parameters.format();
        ImageWriter writer = findWriter(format)
            .orElseThrow(() -> new IOException("No image writer available for " + format));
        log.debug("Encoding {} with {}", format, writer.getClass().getName());

        byte[] encoded;
        try {
            encoded = switch (format) {
                case JPEG -> writeJpeg(writer, image, parameters);
                case PNG -> writePng(writer, image, parameters);
                case TIFF -> writeTiff(writer, image, parameters);
                case HEIF -> writeLossy(writer, image, parameters);
            };
        } finally {
            writer.dispose();
        }

        if (format == SaveFormat.JPEG) {
            Optional<GpsMetadata> gps = parameters.gpsIfPresent();
            if (gps.isPresent()) {
                encoded = metadataPreserver.attachToJpeg(encoded, gps.get());
            }
            Optional<byte[]> profile = parameters.iccProfileIfPresent();
            if (profile.isPresent()) {
                encoded = JpegIccSegments.insert(encoded, profile.get());
            }
        }
        return encoded;
    }

    private byte[] writeJpeg(ImageWriter writer, BufferedImage image, SaveParameters parameters) throws IOException {
        JPEGImageWriteParam param = (JPEGImageWriteParam) writer.getDefaultWriteParam();
        param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
        param.setCompressionQuality(parameters.quality() / 100.0f);
        param.setOptimizeHuffmanTables(parameters.optimize());

        IIOMetadata metadata = writer.getDefaultImageMetadata(ImageTypeSpecifier.createFromRenderedImage(image), param);
        if (!parameters.chromaSubsampling()) {
            IIOMetadataNode root = (IIOMetadataNode) metadata.getAsTree(JPEG_NATIVE_FORMAT);
            IIOMetadataNode sof = (IIOMetadataNode) root.getElementsByTagName("sof").item(0);
            if (sof != null) {
                for (int i = 0; i < sof.getLength(); i++) {
                    IIOMetadataNode component = (IIOMetadataNode) sof.item(i);
                    component.setAttribute("HsamplingFactor", "1");
                    component.setAttribute("VsamplingFactor", "1");
                }
                metadata.setFromTree(JPEG_NATIVE_FORMAT, root);
            }
        }
        return write(writer, new IIOImage(image, null, metadata), param);
    }

    private byte[] writePng(ImageWriter writer, BufferedImage image, SaveParameters parameters) throws IOException {
        ImageWriteParam param = writer.getDefaultWriteParam();
        if (parameters.optimize() && param.canWriteCompressed()) {
            // Lowest "quality" selects the strongest deflate level; PNG stays lossless
            param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
            param.setCompressionQuality(0.0f);
        }

        IIOMetadata metadata = null;
        Optional<byte[]> profile = parameters.iccProfileIfPresent();
        if (profile.isPresent()) {
            metadata = writer.getDefaultImageMetadata(ImageTypeSpecifier.createFromRenderedImage(image), param);
            IIOMetadataNode root = new IIOMetadataNode(PNG_NATIVE_FORMAT);
            IIOMetadataNode iccp = new IIOMetadataNode("iCCP");
            iccp.setAttribute("profileName", "ICC Profile");
            iccp.setAttribute("compressionMethod", "deflate");
            iccp.setUserObject(deflate(profile.get()));
            root.appendChild(iccp);
            metadata.mergeTree(PNG_NATIVE_FORMAT, root);
        }
        return write(writer, new IIOImage(image, null, metadata), param);
    }

    private byte[] writeTiff(ImageWriter writer, BufferedImage image, SaveParameters parameters) throws IOException {
        ImageWriteParam param = writer.getDefaultWriteParam();

        IIOMetadata metadata = null;
        Optional<byte[]> profile = parameters.iccProfileIfPresent();
        if (profile.isPresent()) {
            IIOMetadata defaults = writer.getDefaultImageMetadata(ImageTypeSpecifier.createFromRenderedImage(image), param);
            TIFFDirectory directory = TIFFDirectory.createFromMetadata(defaults);
            TIFFTag iccTag = new TIFFTag("ICCProfile", TIFF_TAG_ICC_PROFILE, 1 << TIFFTag.TIFF_UNDEFINED);
            directory.addTIFFField(new TIFFField(iccTag, TIFFTag.TIFF_UNDEFINED, profile.get().length, profile.get()));
            metadata = directory.getAsMetadata();
        }
        return write(writer, new IIOImage(image, null, metadata), param);
    }

    private byte[] writeLossy(ImageWriter writer, BufferedImage image, SaveParameters parameters) throws IOException {
        ImageWriteParam param = writer.getDefaultWriteParam();
        if (param.canWriteCompressed()) {
            param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
            String[] compressionTypes = param.getCompressionTypes();
            if (compressionTypes != null && compressionTypes.length > 0) {
                param.setCompressionType(compressionTypes[0]);
            }
            param.setCompressionQuality(parameters.quality() / 100.0f);
        }
        if (parameters.iccProfile() != null) {
            log.debug("{} writer does not carry ICC profiles; profile dropped", parameters.format());
        }
        return write(writer, new IIOImage(image, null, null), param);
    }

    private byte[] write(ImageWriter writer, IIOImage image, ImageWriteParam param) throws IOException {
        ByteArrayOutputStream outputStream = new ByteArrayOutputStream();
        try (ImageOutputStream ios = ImageIO.createImageOutputStream(outputStream)) {
            writer.setOutput(ios);
            writer.write(null, image, param);
        }
        return outputStream.toByteArray();
    }

    private Optional<ImageWriter> findWriter(SaveFormat format) {
        for (String name : format.getWriterFormatNames()) {
            Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName(name);
            if (writers.hasNext()) {
                return Optional.of(writers.next());
            }
        }
        return Optional.empty();
    }

    private static byte[] deflate(byte[] data) throws IOException {
        ByteArrayOutputStream compressed = new ByteArrayOutputStream(data.length);
        Deflater deflater = new Deflater(Deflater.BEST_COMPRESSION);
        try (DeflaterOutputStream out = new DeflaterOutputStream(compressed, deflater)) {
            out.write(data);
        } finally {
            deflater.end();
        }
        return compressed.toByteArray();
    }
}
