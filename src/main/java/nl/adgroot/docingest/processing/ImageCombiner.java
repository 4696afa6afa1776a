package nl.adgroot.docingest.processing;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import javax.imageio.ImageIO;

/**
 * Stacks the pages of an image group into one bitmap: width is the widest page, height the sum of
 * all page heights, pages drawn top to bottom at x = 0 in the given order.
 */
public class ImageCombiner {

  /** PNG bytes of the combined canvas together with its size. */
  public record CombinedImage(byte[] png, int width, int height, int pages) {}

  // an int[] raster cannot hold more pixels than this
  static final long MAX_PIXELS = Integer.MAX_VALUE - 8;

  private final long maxPixels;

  public ImageCombiner() {
    this(MAX_PIXELS);
  }

  ImageCombiner(long maxPixels) {
    this.maxPixels = maxPixels;
  }

  public CombinedImage combine(List<Path> pages) throws IOException {
    if (pages.isEmpty()) {
      throw new IllegalArgumentException("Cannot combine an empty image group");
    }

    List<BufferedImage> images = new ArrayList<>(pages.size());
    BufferedImage canvas = null;
    try {
      for (Path page : pages) {
        images.add(read(page));
      }
      canvas = stack(images, maxPixels);
      return new CombinedImage(encodePng(canvas), canvas.getWidth(), canvas.getHeight(), images.size());
    } finally {
      for (BufferedImage image : images) {
        image.flush();
      }
      if (canvas != null) {
        canvas.flush();
      }
    }
  }

  /** @throws IOException when the combined canvas would exceed {@code maxPixels} */
  static BufferedImage stack(List<BufferedImage> images, long maxPixels) throws IOException {
    long width = 0;
    long height = 0;
    for (BufferedImage image : images) {
      width = Math.max(width, image.getWidth());
      height += image.getHeight();
    }
    if (height > Integer.MAX_VALUE || width * height > maxPixels) {
      throw new IOException("Combined image too large: " + width + "x" + height + " for " + images.size() + " pages");
    }

    BufferedImage canvas;
    try {
      canvas = new BufferedImage((int) width, (int) height, BufferedImage.TYPE_INT_RGB);
    } catch (IllegalArgumentException | NegativeArraySizeException e) {
      throw new IOException("Cannot allocate combined image " + width + "x" + height, e);
    }
    Graphics2D g = canvas.createGraphics();
    try {
      // uncovered area right of narrower pages stays white, like paper
      g.setColor(Color.WHITE);
      g.fillRect(0, 0, canvas.getWidth(), canvas.getHeight());

      int y = 0;
      for (BufferedImage image : images) {
        g.drawImage(image, 0, y, null);
        y += image.getHeight();
      }
    } finally {
      g.dispose();
    }
    return canvas;
  }

  private static BufferedImage read(Path page) throws IOException {
    BufferedImage image = ImageIO.read(page.toFile());
    if (image == null) {
      throw new IOException("Unsupported or corrupt image: " + page);
    }
    return image;
  }

  private static byte[] encodePng(BufferedImage canvas) throws IOException {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    if (!ImageIO.write(canvas, "png", out)) {
      throw new IOException("No PNG writer available");
    }
    return out.toByteArray();
  }
}
