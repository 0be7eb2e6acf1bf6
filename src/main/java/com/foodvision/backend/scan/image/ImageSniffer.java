package com.foodvision.backend.scan.image;

import java.io.IOException;
import java.io.PushbackInputStream;
import java.util.Arrays;

/**
 * 用 magic bytes 判斷圖檔格式（不相信 client 給的 Content-Type / 副檔名）。
 */
public final class ImageSniffer {

    private ImageSniffer() {}

    public static final int HEAD_BYTES = 16;

    public enum ImageType {
        JPEG("image/jpeg", ".jpg"),
        PNG("image/png", ".png"),
        WEBP("image/webp", ".webp");

        private final String contentType;
        private final String ext;

        ImageType(String contentType, String ext) {
            this.contentType = contentType;
            this.ext = ext;
        }

        public String contentType() { return contentType; }
        public String ext() { return ext; }
    }

    private static final byte[] PNG_SIG = new byte[] {
            (byte) 0x89, 0x50, 0x4E, 0x47, 0x0D, 0x0A, 0x1A, 0x0A
    };
    private static final byte[] RIFF = new byte[] { 'R', 'I', 'F', 'F' };
    private static final byte[] WEBP = new byte[] { 'W', 'E', 'B', 'P' };

    /**
     * 讀最多 16 bytes 判斷後 push back（後面 storage.save() 還要讀完整檔案）。
     * 認不得回 null。
     */
    public static ImageType detect(PushbackInputStream in) throws IOException {
        byte[] head = new byte[HEAD_BYTES];
        int n = in.readNBytes(head, 0, HEAD_BYTES);
        if (n <= 0) return null;
        in.unread(head, 0, n);
        return detect(head, n);
    }

    public static ImageType detect(byte[] head, int n) {
        if (head == null) return null;
        n = Math.min(n, head.length);

        if (n >= 8 && startsWith(head, 0, n, PNG_SIG)) return ImageType.PNG;

        // JPEG：FF D8 FF
        if (n >= 3 && head[0] == (byte) 0xFF && head[1] == (byte) 0xD8 && head[2] == (byte) 0xFF) {
            return ImageType.JPEG;
        }

        // WEBP：RIFF....WEBP
        if (n >= 12 && startsWith(head, 0, n, RIFF) && startsWith(head, 8, n, WEBP)) {
            return ImageType.WEBP;
        }
        return null;
    }

    private static boolean startsWith(byte[] buf, int offset, int n, byte[] prefix) {
        if (n < offset + prefix.length) return false;
        return Arrays.equals(Arrays.copyOfRange(buf, offset, offset + prefix.length), prefix);
    }
}
