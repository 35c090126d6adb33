package com.example.journey.render;

import com.example.journey.inference.FrameImages;
import com.example.journey.model.BoundingBox;
import com.example.journey.model.Line;
import com.example.journey.model.Point;
import com.example.journey.model.Track;
import com.example.journey.model.Zone;
import com.example.journey.pipeline.FrameResult;
import com.example.journey.pipeline.SceneSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.awt.AlphaComposite;
import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Composite;
import java.awt.FontMetrics;
import java.awt.Graphics2D;
import java.awt.Polygon;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * 在帧上绘制区域、出入线、轨迹框与会话信息，并编码为MJPEG分段
 */
@Slf4j
@Component
public class FrameAnnotator {

    private static final Color[] TRACK_COLORS = {
            Color.RED, Color.GREEN, Color.BLUE, Color.YELLOW,
            Color.MAGENTA, Color.CYAN, Color.ORANGE, Color.PINK
    };

    private static final Color[] ZONE_COLORS = {
            new Color(100, 100, 255), new Color(100, 255, 100), new Color(255, 100, 100),
            new Color(100, 255, 255), new Color(255, 100, 255)
    };

    private static final Color LINE_COLOR = new Color(255, 255, 0);

    /**
     * 在图像上原地绘制标注
     */
    public void draw(BufferedImage image, FrameResult result, SceneSnapshot scene) {
        Graphics2D g2d = image.createGraphics();
        try {
            g2d.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
            drawZones(g2d, scene.getZones());
            drawLines(g2d, scene.getLines());
            drawTracks(g2d, result.getTracks());
            drawHeader(g2d, result);
        } finally {
            g2d.dispose();
        }
    }

    /**
     * 绘制并编码为带边界的MJPEG分段；失败时返回null
     */
    public byte[] render(BufferedImage image, FrameResult result, SceneSnapshot scene) {
        try {
            draw(image, result, scene);
            return toMjpegPart(FrameImages.toJpeg(image));
        } catch (Exception e) {
            log.warn("渲染帧失败: {}", e.getMessage());
            return null;
        }
    }

    static byte[] toMjpegPart(byte[] jpeg) throws IOException {
        String header = "--frame\r\n"
                + "Content-Type: image/jpeg\r\n"
                + "Content-Length: " + jpeg.length + "\r\n\r\n";

        ByteArrayOutputStream mjpegStream = new ByteArrayOutputStream(jpeg.length + 128);
        mjpegStream.write(header.getBytes(StandardCharsets.US_ASCII));
        mjpegStream.write(jpeg);
        mjpegStream.write("\r\n".getBytes(StandardCharsets.US_ASCII));
        return mjpegStream.toByteArray();
    }

    private void drawZones(Graphics2D g2d, List<Zone> zones) {
        for (int i = 0; i < zones.size(); i++) {
            Zone zone = zones.get(i);
            Color color = ZONE_COLORS[i % ZONE_COLORS.length];

            Polygon polygon = new Polygon();
            for (Point p : zone.getPoints()) {
                polygon.addPoint((int) p.getX(), (int) p.getY());
            }

            Composite original = g2d.getComposite();
            g2d.setComposite(AlphaComposite.getInstance(AlphaComposite.SRC_OVER, 0.25f));
            g2d.setColor(color);
            g2d.fillPolygon(polygon);
            g2d.setComposite(original);

            g2d.setStroke(new BasicStroke(2.0f));
            g2d.drawPolygon(polygon);

            Point anchor = zone.getPoints().get(0);
            g2d.drawString(zone.getName(), (int) anchor.getX() + 4, (int) anchor.getY() - 4);
        }
    }

    private void drawLines(Graphics2D g2d, List<Line> lines) {
        g2d.setColor(LINE_COLOR);
        g2d.setStroke(new BasicStroke(3.0f));
        for (int i = 0; i < lines.size(); i++) {
            Line line = lines.get(i);
            int x1 = (int) line.getP1().getX();
            int y1 = (int) line.getP1().getY();
            int x2 = (int) line.getP2().getX();
            int y2 = (int) line.getP2().getY();
            g2d.drawLine(x1, y1, x2, y2);
            g2d.fillOval(x1 - 5, y1 - 5, 10, 10);
            g2d.drawString("L" + i + " P1", x1 + 6, y1 - 6);
            g2d.drawString("P2", x2 + 6, y2 - 6);
        }
    }

    private void drawTracks(Graphics2D g2d, List<Track> tracks) {
        g2d.setStroke(new BasicStroke(2.0f));
        FontMetrics fm = g2d.getFontMetrics();

        for (Track track : tracks) {
            BoundingBox bbox = track.getBox();
            int personId = track.getGlobalPersonId() != null ? track.getGlobalPersonId() : track.getTrackId();
            Color color = TRACK_COLORS[personId % TRACK_COLORS.length];
            g2d.setColor(color);

            int x = (int) bbox.getX1();
            int y = (int) bbox.getY1();
            g2d.drawRect(x, y, (int) bbox.width(), (int) bbox.height());

            String label = String.format("T%d P%s %s", track.getTrackId(),
                    track.getGlobalPersonId() != null ? track.getGlobalPersonId() : "-",
                    track.getSessionId() != null ? track.getSessionId() : "");
            if (track.getCrossEvent() != null) {
                label = label + " " + track.getCrossEvent();
            }

            int labelWidth = fm.stringWidth(label);
            int labelHeight = fm.getHeight();

            // 标签背景
            g2d.fillRect(x, y - labelHeight, labelWidth + 4, labelHeight);

            g2d.setColor(Color.WHITE);
            g2d.drawString(label, x + 2, y - 2);
        }
    }

    private void drawHeader(Graphics2D g2d, FrameResult result) {
        String header = String.format("Frame %d  Tracks %d  Active %d",
                result.getFrameNumber(), result.getTracks().size(), result.getActiveSessions().size());
        g2d.setColor(Color.BLACK);
        g2d.fillRect(0, 0, g2d.getFontMetrics().stringWidth(header) + 12, 22);
        g2d.setColor(Color.WHITE);
        g2d.drawString(header, 6, 16);
    }
}
