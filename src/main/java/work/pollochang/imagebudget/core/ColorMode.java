package work.pollochang.imagebudget.core;

import java.awt.Transparency;
import java.awt.color.ColorSpace;
import java.awt.image.BufferedImage;
import java.awt.image.ColorModel;
import java.awt.image.IndexColorModel;

/**
 * 解碼後影像的色彩模式分類。
 */
public enum ColorMode {
    RGB,
    RGBA,
    GRAY,
    GRAY_ALPHA,
    PALETTE,
    PALETTE_TRANSPARENT,
    BILEVEL,
    OTHER;

    public boolean hasTransparency() {
        return this == RGBA || this == GRAY_ALPHA || this == PALETTE_TRANSPARENT;
    }

    public static ColorMode of(BufferedImage image) {
        ColorModel colorModel = image.getColorModel();
        if (colorModel instanceof IndexColorModel) {
            IndexColorModel indexed = (IndexColorModel) colorModel;
            if (indexed.getTransparency() != Transparency.OPAQUE || indexed.getTransparentPixel() >= 0) {
                return PALETTE_TRANSPARENT;
            }
            return image.getType() == BufferedImage.TYPE_BYTE_BINARY && indexed.getMapSize() <= 2 ? BILEVEL : PALETTE;
        }
        int colorSpaceType = colorModel.getColorSpace().getType();
        if (colorSpaceType == ColorSpace.TYPE_GRAY) {
            return colorModel.hasAlpha() ? GRAY_ALPHA : GRAY;
        }
        if (colorSpaceType == ColorSpace.TYPE_RGB) {
            return colorModel.hasAlpha() ? RGBA : RGB;
        }
        return OTHER;
    }
}
