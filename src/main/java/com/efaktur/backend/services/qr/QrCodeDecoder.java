package com.efaktur.backend.services.qr;

import java.awt.image.BufferedImage;
import java.util.List;

/**
 * Barcode capability: returns the payloads of every QR code readable in the image, or an empty list.
 */
@FunctionalInterface
public interface QrCodeDecoder {

    List<String> decode(BufferedImage image);
}
