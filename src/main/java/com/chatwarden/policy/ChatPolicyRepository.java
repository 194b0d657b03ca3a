package com.chatwarden.policy;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

@Repository
public interface ChatPolicyRepository extends JpaRepository<ChatPolicy, Long> {

    @Query("select max(p.stickerWindowSeconds) as stickerMax, max(p.textWindowSeconds) as textMax, "
            + "max(p.imageWindowSeconds) as imageMax, max(p.videoWindowSeconds) as videoMax "
            + "from ChatPolicy p")
    WindowMaxima findWindowMaxima();

    interface WindowMaxima {
        Integer getStickerMax();
        Integer getTextMax();
        Integer getImageMax();
        Integer getVideoMax();
    }
}
