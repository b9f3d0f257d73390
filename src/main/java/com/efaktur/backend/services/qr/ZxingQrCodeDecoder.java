package com.efaktur.backend.services.qr;

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Component;

import com.google.zxing.BarcodeFormat;
import com.google.zxing.BinaryBitmap;
import com.google.zxing.DecodeHintType;
import com.google.zxing.LuminanceSource;
import com.google.zxing.NotFoundException;
import com.google.zxing.Result;
import com.google.zxing.client.j2se.BufferedImageLuminanceSource;
import com.google.zxing.common.HybridBinarizer;
import com.google.zxing.multi.qrcode.QRCodeMultiReader;

@Component
public class ZxingQrCodeDecoder implements QrCodeDecoder {

    private static final Map<DecodeHintType, Object> HINTS = buildHints();

    @Override
    public List<String> decode(BufferedImage image) {
        if (image == null) return List.of();

        LuminanceSource source = new BufferedImageLuminanceSource(image);
        BinaryBitmap bitmap = new BinaryBitmap(new HybridBinarizer(source));

        Result[] results;
        try {
            // QRCodeMultiReader is not thread-safe.
            results = new QRCodeMultiReader().decodeMultiple(bitmap, HINTS);
        } catch (NotFoundException e) {
            return List.of();
        }

        List<String> payloads = new ArrayList<>(results.length);
        for (Result result : results) {
            if (result != null && result.getText() != null) {
                payloads.add(result.getText());
            }
        }
        return payloads;
    }

    private static Map<DecodeHintType, Object> buildHints() {
        Map<DecodeHintType, Object> hints = new EnumMap<>(DecodeHintType.class);
        hints.put(DecodeHintType.POSSIBLE_FORMATS, List.of(BarcodeFormat.QR_CODE));
        hints.put(DecodeHintType.TRY_HARDER, Boolean.TRUE);
        hints.put(DecodeHintType.CHARACTER_SET, "UTF-8");
        return hints;
    }
}
